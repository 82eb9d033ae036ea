package net.dbbeat.core.model;

import java.util.Locale;

public enum RunStatus {
    PENDING, STARTED, SUCCESS, FAILURE, RETRY, REVOKED;

    public boolean terminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }

    public static RunStatus from(String s) {
        if (s == null) return PENDING;
        try { return RunStatus.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return PENDING; }
    }

    public String code() { return name(); }
}
