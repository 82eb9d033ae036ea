package net.dbbeat.core.model;

public record SchedulerStatistics(
        long totalJobs,
        long enabledJobs,
        long disabledJobs,
        long totalRuns,
        long successRuns,
        long failureRuns,
        long pendingRuns
) {}
