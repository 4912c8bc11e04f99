package com.tollgate.quota.store;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative quota storage. Every method throws {@link com.tollgate.quota.QuotaStoreException} on database failure.
 */
public interface QuotaStore {

    Optional<ProjectQuota> fetch(UUID projectId);

    /**
     * Atomically charges {@code units} against the month starting at {@code monthStart}. Usage resets to
     * {@code units} when the stored month differs; the all-time total always grows by {@code units}.
     * Nothing is written when the new monthly usage would exceed the limit.
     *
     * @return the committed (used, limit), or empty when the row is missing or the limit would be exceeded
     */
    Optional<QuotaCharge> tryCharge(UUID projectId, long units, LocalDate monthStart);

    /**
     * Bills units that were already accepted without a database round trip. The all-time total always
     * grows by {@code units}; monthly usage grows too (with the same rollover rule) but is capped at the limit.
     *
     * @return false when the project has no row
     */
    boolean chargeDeferred(UUID projectId, long units, LocalDate monthStart);

    /** Inserts a quota row with zero usage. Returns false when the project already has one. */
    boolean provision(UUID projectId, long limit, LocalDate monthStart);

    /** Returns false when the project has no row. */
    boolean updateLimit(UUID projectId, long limit);
}
