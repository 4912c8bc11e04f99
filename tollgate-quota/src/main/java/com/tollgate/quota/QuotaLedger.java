package com.tollgate.quota;

import com.tollgate.cache.FastCache;
import com.tollgate.quota.store.ProjectQuota;
import com.tollgate.quota.store.QuotaCharge;
import com.tollgate.quota.store.QuotaStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Monthly quota enforcement per project.
 * <p>
 * <b>Fast path:</b> every charge first increments the cached counter atomically. When the value before the
 * increment is below the limit, the value after it stays within {@code limit + softWindow} and no
 * write-through checkpoint is crossed, the charge is accepted from the cache alone. Those units also go
 * into an atomic pending counter and are billed to the database by the next hard-path call.
 * <p>
 * <b>Hard path:</b> pending units are taken with an atomic get-and-reset and billed unconditionally
 * (monthly usage capped at the limit), then the request itself goes through a single conditional update in
 * {@link QuotaStore#tryCharge}. The database is the only enforcement boundary. The cached counter is only
 * ever raised, to the returned usage on success and to the limit on rejection, so concurrent fast-path
 * increments are never overwritten. No application-level lock is taken.
 * <p>
 * A missing counter (cold or unreachable cache) always takes the hard path.
 */
public final class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    static final String METRIC_CONSUME = "tollgate.quota.consume";

    private final QuotaStore store;
    private final FastCache cache;
    private final QuotaSettings settings;
    private final Clock clock;
    private final Counter fastAccepted;
    private final Counter hardAccepted;
    private final Counter hardExceeded;

    public QuotaLedger(QuotaStore store, FastCache cache, QuotaSettings settings, Clock clock, MeterRegistry registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fastAccepted = consumeCounter(registry, "fast", "accepted");
        this.hardAccepted = consumeCounter(registry, "hard", "accepted");
        this.hardExceeded = consumeCounter(registry, "hard", "exceeded");
    }

    /**
     * Charges {@code count} units against the project's quota for the current month.
     * A count of zero or less returns immediately without touching any state.
     *
     * @throws ProjectNotFoundException       when the project has no quota row
     * @throws MonthlyQuotaExceededException  when the charge would exceed the monthly limit
     * @throws QuotaStoreException            on database failure
     */
    public void consume(UUID projectId, int count) {
        Objects.requireNonNull(projectId, "projectId");
        if (count <= 0) {
            return;
        }
        MonthWindow window = MonthWindow.current(clock, settings.zone());
        long ttl = window.secondsUntilMonthEnd();
        String counterKey = QuotaKeys.counter(projectId, window);
        String limitKey = QuotaKeys.limit(projectId, window);

        ProjectQuota row = null;
        Optional<Long> cachedLimit = cache.get(limitKey);
        long limit;
        if (cachedLimit.isPresent()) {
            limit = cachedLimit.get();
        } else {
            row = fetchExisting(projectId);
            limit = row.limit();
            cache.set(limitKey, limit, ttl);
        }

        boolean seeded = false;
        if (cache.get(counterKey).isEmpty()) {
            if (row == null) {
                row = fetchExisting(projectId);
            }
            cache.setIfAbsent(counterKey, row.usedIn(window.monthStartDate()), ttl);
            seeded = true;
        }

        Optional<Long> after = cache.increment(counterKey, count, ttl);
        if (!seeded && after.isPresent() && acceptsFromCache(limit, after.get() - count, after.get())
                && cache.increment(QuotaKeys.pending(projectId, window), count, ttl).isPresent()) {
            fastAccepted.increment();
            return;
        }
        chargeDatabase(projectId, count, window);
    }

    /** Current-month usage as recorded in the database. Pending fast-path units are not included. */
    public QuotaUsage usage(UUID projectId) {
        MonthWindow window = MonthWindow.current(clock, settings.zone());
        ProjectQuota row = fetchExisting(projectId);
        return new QuotaUsage(projectId, window.monthStartDate(), row.usedIn(window.monthStartDate()),
                row.limit(), row.totalUsed());
    }

    /**
     * Creates the project's quota row for the current month with zero usage.
     *
     * @return false when the project already had a row (left unchanged)
     */
    public boolean provision(UUID projectId, long monthlyLimit) {
        if (monthlyLimit < 0) {
            throw new IllegalArgumentException("monthlyLimit must be >= 0, got " + monthlyLimit);
        }
        MonthWindow window = MonthWindow.current(clock, settings.zone());
        return store.provision(projectId, monthlyLimit, window.monthStartDate());
    }

    /**
     * Replaces the stored limit with the one from {@code plans} and refreshes the cached limit.
     *
     * @return the applied limit
     */
    public long applyPlanLimit(UUID projectId, PlanLimitProvider plans) {
        long limit = plans.monthlyQuotaLimit(projectId);
        if (limit < 0) {
            throw new IllegalArgumentException("Plan limit must be >= 0 for project " + projectId + ", got " + limit);
        }
        if (!store.updateLimit(projectId, limit)) {
            log.error("Plan limit not applied: project {} has no quota row", projectId);
            throw new ProjectNotFoundException(projectId);
        }
        MonthWindow window = MonthWindow.current(clock, settings.zone());
        cache.set(QuotaKeys.limit(projectId, window), limit, window.secondsUntilMonthEnd());
        log.info("Plan limit applied | project={} limit={}", projectId, limit);
        return limit;
    }

    boolean acceptsFromCache(long limit, long before, long after) {
        if (before >= limit || after > limit + settings.softWindow(limit)) {
            return false;
        }
        long step = settings.checkpointStep(limit);
        return before / step == after / step;
    }

    private void chargeDatabase(UUID projectId, int count, MonthWindow window) {
        long ttl = window.secondsUntilMonthEnd();
        LocalDate month = window.monthStartDate();
        String counterKey = QuotaKeys.counter(projectId, window);
        String pendingKey = QuotaKeys.pending(projectId, window);

        long deferred = Math.max(0L, cache.getAndSet(pendingKey, 0L, ttl).orElse(0L));
        if (deferred > 0) {
            try {
                store.chargeDeferred(projectId, deferred, month);
            } catch (QuotaStoreException e) {
                cache.increment(pendingKey, deferred, ttl);
                throw e;
            }
        }

        Optional<QuotaCharge> charge = store.tryCharge(projectId, count, month);
        if (charge.isPresent()) {
            raiseCounter(counterKey, charge.get().used(), ttl);
            cache.set(QuotaKeys.limit(projectId, window), charge.get().limit(), ttl);
            hardAccepted.increment();
            return;
        }

        Optional<ProjectQuota> row = store.fetch(projectId);
        if (row.isEmpty()) {
            log.error("Quota charge rejected: project {} does not exist", projectId);
            throw new ProjectNotFoundException(projectId);
        }
        long limit = row.get().limit();
        raiseCounter(counterKey, limit, ttl);
        cache.set(QuotaKeys.limit(projectId, window), limit, ttl);
        hardExceeded.increment();
        long used = row.get().usedIn(month);
        log.info("Monthly quota exceeded | project={} month={} requested={} used={} limit={}",
                projectId, window.monthKey(), count, used, limit);
        throw new MonthlyQuotaExceededException(projectId, count, used, limit);
    }

    /** Lifts the cached counter to at least {@code floor} by an increment, so concurrent increments survive. */
    private void raiseCounter(String counterKey, long floor, long ttl) {
        Optional<Long> current = cache.get(counterKey);
        if (current.isEmpty()) {
            cache.setIfAbsent(counterKey, floor, ttl);
        } else if (current.get() < floor) {
            cache.increment(counterKey, floor - current.get(), ttl);
        }
    }

    private ProjectQuota fetchExisting(UUID projectId) {
        Optional<ProjectQuota> row = store.fetch(projectId);
        if (row.isEmpty()) {
            log.error("Quota lookup failed: project {} does not exist", projectId);
            throw new ProjectNotFoundException(projectId);
        }
        return row.get();
    }

    private static Counter consumeCounter(MeterRegistry registry, String path, String outcome) {
        return Counter.builder(METRIC_CONSUME)
                .tag("path", path)
                .tag("outcome", outcome)
                .register(registry);
    }
}
