package com.tollgate.executionlog.appender;

import com.tollgate.config.DropPolicy;
import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.LogEvent;
import com.tollgate.executionlog.store.ExecutionLogStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single background worker of an appender. Every {@code flushInterval} (or immediately on stop)
 * the worker drains up to {@code maxBatch} events and hands them to the {@link ExecutionLogStore}; it keeps
 * draining while batches come back full. A batch whose write fails is logged and discarded. On a graceful
 * stop one final drain runs before the worker exits.
 * <p>
 * Subclasses provide the buffer: {@link #enqueue(LogEvent)} and {@link #drain(int)}.
 */
public abstract class AbstractLogAppender implements LogAppender {

    private static final Logger log = LoggerFactory.getLogger(AbstractLogAppender.class);

    private final String name;
    private final ExecutionLogStore store;
    private final int maxBatch;
    private final Duration flushInterval;
    private final DropPolicy dropPolicy;
    private final AtomicLong dropped = new AtomicLong();
    final AppenderMetrics metrics;

    private ExecutorService worker;
    private CountDownLatch stopSignal;
    private volatile boolean running;

    protected AbstractLogAppender(String name, ExecutionLogStore store, int maxBatch, Duration flushInterval,
                                  DropPolicy dropPolicy, MeterRegistry registry) {
        this.name = Objects.requireNonNull(name, "name");
        this.store = Objects.requireNonNull(store, "store");
        if (maxBatch < 1) {
            throw new IllegalArgumentException("maxBatch must be >= 1, got " + maxBatch);
        }
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be positive, got " + flushInterval);
        }
        this.maxBatch = maxBatch;
        this.flushInterval = flushInterval;
        this.dropPolicy = Objects.requireNonNull(dropPolicy, "dropPolicy");
        this.metrics = new AppenderMetrics(registry, name);
    }

    /**
     * Removes and returns up to {@code max} buffered events, oldest first. Called only from the worker thread.
     */
    protected abstract List<LogEvent> drain(int max);

    public DropPolicy getDropPolicy() {
        return dropPolicy;
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.debug("Appender {} already running", name);
            return;
        }
        CountDownLatch signal = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tollgate-" + name + "-appender");
            t.setDaemon(true);
            return t;
        });
        stopSignal = signal;
        worker = executor;
        running = true;
        executor.execute(() -> runLoop(signal));
        log.info("Execution log appender started | implementation={} maxBatch={} flushEvery={}ms dropPolicy={}",
                name, maxBatch, flushInterval.toMillis(), dropPolicy.id());
    }

    @Override
    public synchronized void stop(Duration timeout) {
        if (!running) {
            return;
        }
        running = false;
        stopSignal.countDown();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Appender {} did not finish within {}ms; cancelling worker", name, timeout.toMillis());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Execution log appender stopped | implementation={} dropped={}", name, dropped.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    protected final void recordEnqueued() {
        metrics.enqueued.increment();
    }

    protected final void recordDrop(String reason) {
        long total = dropped.incrementAndGet();
        metrics.dropped.increment();
        if (total == 1 || total % 1000 == 0) {
            log.warn("Execution log dropped | implementation={} reason={} droppedTotal={}", name, reason, total);
        }
    }

    private void runLoop(CountDownLatch signal) {
        try {
            boolean stopping = false;
            while (!stopping) {
                stopping = signal.await(flushInterval.toMillis(), TimeUnit.MILLISECONDS);
                flushAvailable();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Appender {} worker interrupted; buffered events left unflushed", name);
        }
    }

    /** Drains and writes batches until a batch comes back short or the worker is interrupted. */
    void flushAvailable() {
        while (!Thread.currentThread().isInterrupted()) {
            List<LogEvent> batch;
            try {
                batch = drain(maxBatch);
            } catch (RuntimeException e) {
                log.warn("Appender {} failed to drain buffer: {}", name, e.getMessage());
                return;
            }
            if (batch.isEmpty()) return;
            flush(batch);
            if (batch.size() < maxBatch) return;
        }
    }

    private void flush(List<LogEvent> batch) {
        try {
            store.saveBatch(batch);
            metrics.flushed.increment(batch.size());
            log.debug("Appender {} flushed {} event(s)", name, batch.size());
        } catch (Exception e) {
            metrics.flushFailures.increment();
            log.warn("Appender {} failed to flush {} event(s); batch discarded", name, batch.size(), e);
        }
    }
}
