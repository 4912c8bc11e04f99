package com.tollgate.executionlog.appender;

import com.tollgate.config.DropPolicy;
import com.tollgate.executionlog.LogEvent;
import com.tollgate.executionlog.store.ExecutionLogStore;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Buffers events in a bounded in-process queue. Enqueue never blocks: with {@link DropPolicy#DROP_NEW} a
 * full queue rejects the incoming event, with {@link DropPolicy#DROP_OLDEST} it evicts the head to make room.
 * Buffered events are lost if the process dies.
 */
public final class QueueLogAppender extends AbstractLogAppender {

    public static final String IMPLEMENTATION = "queue";

    private final BlockingQueue<LogEvent> queue;

    public QueueLogAppender(ExecutionLogStore store, int maxQueue, int maxBatch, Duration flushInterval,
                            DropPolicy dropPolicy, MeterRegistry registry) {
        super(IMPLEMENTATION, store, maxBatch, flushInterval, dropPolicy, registry);
        this.queue = new ArrayBlockingQueue<>(maxQueue);
    }

    @Override
    public Optional<UUID> enqueue(LogEvent event) {
        if (queue.offer(event)) {
            recordEnqueued();
            return Optional.of(event.getId());
        }
        if (getDropPolicy() == DropPolicy.DROP_OLDEST) {
            if (queue.poll() != null) {
                recordDrop("evicted oldest");
            }
            if (queue.offer(event)) {
                recordEnqueued();
                return Optional.of(event.getId());
            }
        }
        recordDrop("queue full");
        return Optional.empty();
    }

    @Override
    protected List<LogEvent> drain(int max) {
        List<LogEvent> batch = new ArrayList<>(Math.min(max, queue.size()));
        queue.drainTo(batch, max);
        return batch;
    }

    int size() {
        return queue.size();
    }
}
