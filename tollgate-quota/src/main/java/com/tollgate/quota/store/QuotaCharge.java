package com.tollgate.quota.store;

/** Row values returned by a successful charge. */
public record QuotaCharge(long used, long limit) {
}
