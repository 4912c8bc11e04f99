package com.tollgate.executionlog.appender;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tollgate.config.DropPolicy;
import com.tollgate.executionlog.LogEvent;
import com.tollgate.executionlog.codec.LogEventCodec;
import com.tollgate.executionlog.codec.MalformedLogEventException;
import com.tollgate.executionlog.store.ExecutionLogStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Buffers events as JSON in an {@link ExternalLogQueue}, so several processes share one buffer and events
 * survive a process restart. The list is capped at {@code maxQueue}: {@link DropPolicy#DROP_OLDEST} pushes and
 * trims the oldest overflow, {@link DropPolicy#DROP_NEW} refuses the push when the list is full. Both are single
 * atomic queue operations. Transport and encoding failures count as drops and are never raised.
 */
public final class RedisLogAppender extends AbstractLogAppender {

    private static final Logger log = LoggerFactory.getLogger(RedisLogAppender.class);

    public static final String IMPLEMENTATION = "redis";

    private final ExternalLogQueue queue;
    private final LogEventCodec codec;
    private final int maxQueue;

    public RedisLogAppender(ExternalLogQueue queue, LogEventCodec codec, ExecutionLogStore store, int maxQueue,
                            int maxBatch, Duration flushInterval, DropPolicy dropPolicy, MeterRegistry registry) {
        super(IMPLEMENTATION, store, maxBatch, flushInterval, dropPolicy, registry);
        this.queue = Objects.requireNonNull(queue, "queue");
        this.codec = Objects.requireNonNull(codec, "codec");
        if (maxQueue < 1) {
            throw new IllegalArgumentException("maxQueue must be >= 1, got " + maxQueue);
        }
        this.maxQueue = maxQueue;
    }

    @Override
    public Optional<UUID> enqueue(LogEvent event) {
        String json;
        try {
            json = codec.encode(event);
        } catch (JsonProcessingException e) {
            log.warn("Execution log {} could not be encoded: {}", event.getId(), e.getOriginalMessage());
            recordDrop("encoding failed");
            return Optional.empty();
        }
        try {
            if (getDropPolicy() == DropPolicy.DROP_OLDEST) {
                long evicted = queue.pushEvictingOldest(json, maxQueue);
                for (long i = 0; i < evicted; i++) {
                    recordDrop("evicted oldest");
                }
                recordEnqueued();
                return Optional.of(event.getId());
            }
            if (queue.pushIfRoom(json, maxQueue).isEmpty()) {
                recordDrop("queue full");
                return Optional.empty();
            }
            recordEnqueued();
            return Optional.of(event.getId());
        } catch (RuntimeException e) {
            log.debug("External log queue {} unavailable: {}", queue, e.getMessage());
            recordDrop("transport failure");
            return Optional.empty();
        }
    }

    @Override
    protected List<LogEvent> drain(int max) {
        List<LogEvent> batch = new ArrayList<>();
        while (batch.size() < max) {
            Optional<String> item;
            try {
                item = queue.popOldest();
            } catch (RuntimeException e) {
                log.warn("External log queue {} unavailable while draining: {}", queue, e.getMessage());
                break;
            }
            if (item.isEmpty()) break;
            try {
                batch.add(codec.decode(item.get()));
            } catch (MalformedLogEventException e) {
                metrics.malformed.increment();
                log.warn("Skipping malformed execution log item: {}", e.getMessage());
            }
        }
        return batch;
    }
}
