package net.dbbeat.core.service;

public enum SchedulerState {
    INITIALIZING, IDLE, DISPATCHING, SYNCING, RELOADING, STOPPED
}
