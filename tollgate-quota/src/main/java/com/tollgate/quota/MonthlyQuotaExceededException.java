package com.tollgate.quota;

import java.util.UUID;

/**
 * The charge would take the project past its monthly limit. An expected rejection, not a fault.
 */
public final class MonthlyQuotaExceededException extends RuntimeException {

    private final UUID projectId;
    private final long requested;
    private final long used;
    private final long limit;

    public MonthlyQuotaExceededException(UUID projectId, long requested, long used, long limit) {
        super(String.format("Monthly quota exceeded for project=%s: requested=%d used=%d limit=%d",
                projectId, requested, used, limit));
        this.projectId = projectId;
        this.requested = requested;
        this.used = used;
        this.limit = limit;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public long getRequested() {
        return requested;
    }

    /** Usage recorded for the month when the charge was rejected. */
    public long getUsed() {
        return used;
    }

    public long getLimit() {
        return limit;
    }
}
