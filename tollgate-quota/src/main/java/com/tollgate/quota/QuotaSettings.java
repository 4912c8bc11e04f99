package com.tollgate.quota;

import com.tollgate.config.TollgateConfig;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Fast-path tunables for {@link QuotaLedger}.
 *
 * @param zone               zone whose calendar month bounds the quota
 * @param softWindowFraction share of the limit the cache may overshoot before deferring to the database
 * @param softWindowMinimum  lower bound of the soft window, in units
 * @param checkpointFraction share of the limit between forced database write-throughs
 */
public record QuotaSettings(ZoneId zone, double softWindowFraction, long softWindowMinimum, double checkpointFraction) {

    public QuotaSettings {
        Objects.requireNonNull(zone, "zone");
    }

    public static QuotaSettings fromConfig(TollgateConfig config) {
        return new QuotaSettings(config.getQuotaZone(), config.getQuotaSoftWindowFraction(),
                config.getQuotaSoftWindowMinimum(), config.getQuotaCheckpointFraction());
    }

    public long softWindow(long limit) {
        return Math.max(softWindowMinimum, (long) Math.floor(limit * softWindowFraction));
    }

    public long checkpointStep(long limit) {
        return Math.max(1L, (long) Math.floor(limit * checkpointFraction));
    }
}
