package com.tollgate.quota;

import java.util.UUID;

/** Fast cache key layout: {@code quota:{projectId}:{yyyyMM}} plus suffixes. */
final class QuotaKeys {

    private QuotaKeys() {
    }

    static String counter(UUID projectId, MonthWindow window) {
        return "quota:" + projectId + ":" + window.monthKey();
    }

    static String limit(UUID projectId, MonthWindow window) {
        return counter(projectId, window) + ":limit";
    }

    /** Units accepted by the fast path and not yet charged to the database. */
    static String pending(UUID projectId, MonthWindow window) {
        return counter(projectId, window) + ":pending";
    }
}
