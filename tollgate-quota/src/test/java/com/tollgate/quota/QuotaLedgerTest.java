package com.tollgate.quota;

import com.tollgate.cache.FastCache;
import com.tollgate.cache.InMemoryFastCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaLedgerTest {

    private static final ZoneId BANGKOK = ZoneId.of("Asia/Bangkok");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-10T05:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate APRIL = LocalDate.of(2024, 4, 1);
    private static final QuotaSettings SETTINGS = new QuotaSettings(BANGKOK, 0.05, 10, 0.10);

    private final UUID project = UUID.randomUUID();
    private InMemoryQuotaStore store;
    private InMemoryFastCache cache;
    private SimpleMeterRegistry registry;
    private QuotaLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryQuotaStore();
        cache = new InMemoryFastCache(CLOCK, 60);
        registry = new SimpleMeterRegistry();
        ledger = new QuotaLedger(store, cache, SETTINGS, CLOCK, registry);
    }

    @Test
    void consume_nonPositiveCountTouchesNothing() {
        store.put(project, 100, 10, APRIL, 10);

        ledger.consume(project, 0);
        ledger.consume(project, -3);
        ledger.consume(UUID.randomUUID(), 0);

        assertEquals(0, store.fetchCalls());
        assertEquals(0, store.chargeCalls());
        assertEquals(10, store.row(project).used());
    }

    @Test
    void consume_concurrentChargesNearLimitRejectTheOverflow() throws Exception {
        store.put(project, 100, 95, APRIL, 95);
        QuotaLedger databaseOnly = new QuotaLedger(store, new UnreachableCache(), SETTINGS, CLOCK, registry);

        AtomicInteger exceeded = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            for (int i = 0; i < 3; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    try {
                        databaseOnly.consume(project, 2);
                    } catch (MonthlyQuotaExceededException e) {
                        exceeded.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, exceeded.get());
        assertEquals(99, store.row(project).used());
        assertTrue(store.maxCommittedUsed() <= 100);
    }

    @Test
    void consume_manyThreadsNeverCommitPastLimit() throws Exception {
        store.put(project, 500, 0, APRIL, 0);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 16; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 50; i++) {
                        try {
                            ledger.consume(project, 1 + (i % 3));
                        } catch (MonthlyQuotaExceededException ignored) {
                            // expected once the month is full
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(store.maxCommittedUsed() <= 500, "committed " + store.maxCommittedUsed());
        assertTrue(store.row(project).used() <= 500);
    }

    @Test
    void consume_staleMonthResetsUsageToTheCharge() {
        store.put(project, 100, 80, LocalDate.of(2024, 3, 1), 500);

        ledger.consume(project, 5);

        assertEquals(5, store.row(project).used());
        assertEquals(APRIL, store.row(project).month());
        assertEquals(505, store.row(project).totalUsed());
    }

    @Test
    void consume_unknownProjectFailsWithoutCharging() {
        UUID unknown = UUID.randomUUID();

        ProjectNotFoundException e = assertThrows(ProjectNotFoundException.class, () -> ledger.consume(unknown, 1));

        assertEquals(unknown, e.getProjectId());
        assertEquals(0, store.chargeCalls());
    }

    @Test
    void consume_fastPathDefersUntilCheckpoint() {
        store.put(project, 1000, 0, APRIL, 0);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);

        ledger.consume(project, 1);
        assertEquals(1, store.chargeCalls());
        assertEquals(1, store.row(project).used());

        ledger.consume(project, 1);
        ledger.consume(project, 97);
        assertEquals(1, store.chargeCalls());
        assertEquals(1, store.row(project).used());
        assertEquals(Optional.of(99L), cache.get(QuotaKeys.counter(project, window)));
        assertEquals(Optional.of(98L), cache.get(QuotaKeys.pending(project, window)));

        ledger.consume(project, 1);
        assertEquals(2, store.chargeCalls());
        assertEquals(100, store.row(project).used());
        assertEquals(Optional.of(100L), cache.get(QuotaKeys.counter(project, window)));
        assertEquals(Optional.of(0L), cache.get(QuotaKeys.pending(project, window)));
        assertEquals(1, store.deferredCalls());
        assertEquals(100, store.row(project).totalUsed());

        assertEquals(2.0, registry.get(QuotaLedger.METRIC_CONSUME).tag("path", "fast").tag("outcome", "accepted").counter().count());
        assertEquals(2.0, registry.get(QuotaLedger.METRIC_CONSUME).tag("path", "hard").tag("outcome", "accepted").counter().count());
    }

    @Test
    void consume_rejectionClampsCounterAndNextChargeGoesToDatabase() {
        store.put(project, 100, 99, APRIL, 99);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);

        MonthlyQuotaExceededException e = assertThrows(MonthlyQuotaExceededException.class, () -> ledger.consume(project, 5));
        assertEquals(99, e.getUsed());
        assertEquals(100, e.getLimit());
        assertEquals(5, e.getRequested());
        assertTrue(cache.get(QuotaKeys.counter(project, window)).orElseThrow() >= 100);

        ledger.consume(project, 1);

        assertEquals(2, store.chargeCalls());
        assertEquals(100, store.row(project).used());
        assertEquals(1.0, registry.get(QuotaLedger.METRIC_CONSUME).tag("path", "hard").tag("outcome", "exceeded").counter().count());
    }

    @Test
    void consume_deferredUnitsAreBilledEvenWhenTheMonthIsFull() {
        store.put(project, 100, 0, APRIL, 0);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);
        ledger.consume(project, 1);
        ledger.consume(project, 5);
        assertEquals(Optional.of(5L), cache.get(QuotaKeys.pending(project, window)));

        // another instance charged the database in the meantime
        store.put(project, 100, 95, APRIL, 95);
        assertThrows(MonthlyQuotaExceededException.class, () -> ledger.consume(project, 4));

        assertEquals(100, store.row(project).used());
        assertEquals(100, store.row(project).totalUsed());
        assertEquals(Optional.of(0L), cache.get(QuotaKeys.pending(project, window)));
        assertTrue(store.maxCommittedUsed() <= 100);
    }

    @Test
    void consume_failedDeferredBillingKeepsUnitsPending() {
        store.put(project, 1000, 0, APRIL, 0);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);
        ledger.consume(project, 1);
        ledger.consume(project, 50);
        store.failDeferred(true);

        assertThrows(QuotaStoreException.class, () -> ledger.consume(project, 60));
        assertEquals(Optional.of(50L), cache.get(QuotaKeys.pending(project, window)));

        store.failDeferred(false);
        ledger.consume(project, 90);
        assertEquals(141, store.row(project).used());
        assertEquals(Optional.of(0L), cache.get(QuotaKeys.pending(project, window)));
    }

    @Test
    void consume_concurrentFastPathStaysWithinSoftWindowAndBillsEveryAcceptedUnit() throws Exception {
        // limit 1000: soft window 50, checkpoint step 100
        store.put(project, 1000, 0, APRIL, 0);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);
        AtomicInteger accepted = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(32);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 32; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 100; i++) {
                        try {
                            ledger.consume(project, 1);
                            accepted.incrementAndGet();
                        } catch (MonthlyQuotaExceededException ignored) {
                            // expected once the month is full
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        long unbilled = cache.get(QuotaKeys.pending(project, window)).orElse(0L);
        assertTrue(accepted.get() <= 1000 + SETTINGS.softWindow(1000), "accepted " + accepted.get());
        assertEquals(accepted.get(), store.row(project).totalUsed() + unbilled);
        assertEquals(1000, store.row(project).used());
        assertTrue(store.maxCommittedUsed() <= 1000);
    }

    @Test
    void acceptsFromCache_requiresHeadroomWindowAndNoCheckpoint() {
        // limit 200: soft window max(10, 10) = 10, checkpoint step 20
        assertTrue(ledger.acceptsFromCache(200, 21, 25));
        assertFalse(ledger.acceptsFromCache(200, 35, 40));
        assertFalse(ledger.acceptsFromCache(200, 200, 201));
        assertFalse(ledger.acceptsFromCache(200, 190, 211));
        assertTrue(ledger.acceptsFromCache(200, 181, 199));
    }

    @Test
    void usage_reportsCurrentMonthFromDatabase() {
        store.put(project, 100, 40, APRIL, 340);

        QuotaUsage usage = ledger.usage(project);

        assertEquals(APRIL, usage.month());
        assertEquals(40, usage.used());
        assertEquals(60, usage.remaining());
        assertEquals(340, usage.totalUsed());

        store.put(project, 100, 40, LocalDate.of(2024, 3, 1), 340);
        assertEquals(0, ledger.usage(project).used());
    }

    @Test
    void provision_createsRowOnce() {
        UUID fresh = UUID.randomUUID();

        assertTrue(ledger.provision(fresh, 250));
        assertFalse(ledger.provision(fresh, 999));

        assertEquals(250, store.row(fresh).limit());
        assertEquals(0, store.row(fresh).used());
        assertEquals(APRIL, store.row(fresh).month());
        assertThrows(IllegalArgumentException.class, () -> ledger.provision(UUID.randomUUID(), -1));
    }

    @Test
    void applyPlanLimit_updatesStoreAndCachedLimit() {
        store.put(project, 100, 0, APRIL, 0);
        MonthWindow window = MonthWindow.current(CLOCK, BANGKOK);
        ledger.consume(project, 1);

        assertEquals(5000, ledger.applyPlanLimit(project, id -> 5000));

        assertEquals(5000, store.row(project).limit());
        assertEquals(Optional.of(5000L), cache.get(QuotaKeys.limit(project, window)));
        assertThrows(ProjectNotFoundException.class, () -> ledger.applyPlanLimit(UUID.randomUUID(), id -> 10));
    }

    /** Cache whose backend is down: reads miss, writes vanish. */
    private static final class UnreachableCache implements FastCache {
        @Override
        public Optional<Long> get(String key) {
            return Optional.empty();
        }

        @Override
        public void set(String key, long value, long ttlSeconds) {
        }

        @Override
        public boolean setIfAbsent(String key, long value, long ttlSeconds) {
            return false;
        }

        @Override
        public Optional<Long> increment(String key, long delta, long ttlSeconds) {
            return Optional.empty();
        }

        @Override
        public Optional<Long> getAndSet(String key, long value, long ttlSeconds) {
            return Optional.empty();
        }
    }
}
