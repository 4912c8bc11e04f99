package com.tollgate.quota;

import java.time.LocalDate;
import java.util.UUID;

/** Database view of a project's quota for the current month. */
public record QuotaUsage(UUID projectId, LocalDate month, long used, long limit, long totalUsed) {

    public long remaining() {
        return Math.max(0L, limit - used);
    }
}
