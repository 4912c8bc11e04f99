package com.tollgate.quota;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Calendar month containing a given instant, in a given zone. Deterministic for a given (instant, zone) pair.
 */
public final class MonthWindow {

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyyMM");

    private final Instant now;
    private final LocalDate monthStartDate;
    private final Instant monthStart;
    private final Instant nextMonthStart;

    private MonthWindow(Instant now, ZoneId zone) {
        this.now = now;
        this.monthStartDate = now.atZone(zone).toLocalDate().withDayOfMonth(1);
        this.monthStart = monthStartDate.atStartOfDay(zone).toInstant();
        this.nextMonthStart = monthStartDate.plusMonths(1).atStartOfDay(zone).toInstant();
    }

    public static MonthWindow of(Instant now, ZoneId zone) {
        return new MonthWindow(Objects.requireNonNull(now, "now"), Objects.requireNonNull(zone, "zone"));
    }

    public static MonthWindow current(Clock clock, ZoneId zone) {
        return of(clock.instant(), zone);
    }

    public Instant monthStart() {
        return monthStart;
    }

    public Instant nextMonthStart() {
        return nextMonthStart;
    }

    /** Whole seconds left in the month, at least 1 so it can always be used as a TTL. */
    public long secondsUntilMonthEnd() {
        return Math.max(1L, Duration.between(now, nextMonthStart).getSeconds());
    }

    /** {@code yyyyMM}, e.g. {@code 202404}. */
    public String monthKey() {
        return MONTH_KEY.format(monthStartDate);
    }

    public LocalDate monthStartDate() {
        return monthStartDate;
    }

    @Override
    public String toString() {
        return "MonthWindow{" + monthKey() + ", " + monthStart + " .. " + nextMonthStart + "}";
    }
}
