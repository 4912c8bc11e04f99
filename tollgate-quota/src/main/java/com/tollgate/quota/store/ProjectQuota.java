package com.tollgate.quota.store;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Quota columns of one {@code projects} row.
 *
 * @param month first day of the month {@code used} belongs to; null when never charged
 */
public record ProjectQuota(UUID projectId, long limit, long used, LocalDate month, long totalUsed) {

    /** Usage attributable to the month starting at {@code monthStart}: 0 when the stored month is another one. */
    public long usedIn(LocalDate monthStart) {
        return monthStart.equals(month) ? used : 0L;
    }
}
