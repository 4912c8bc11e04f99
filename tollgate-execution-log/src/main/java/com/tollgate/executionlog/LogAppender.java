package com.tollgate.executionlog;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Non-blocking sink for {@link LogEvent}s. Events are buffered and persisted in batches by one background
 * worker owned by the appender; losing events under saturation is accepted, blocking the caller is not.
 */
public interface LogAppender {

    /**
     * Buffers the event without blocking.
     *
     * @return the event id when buffered, empty when dropped (saturation or transport failure)
     */
    Optional<UUID> enqueue(LogEvent event);

    /** Starts the background worker. Calling it again while running has no effect. */
    void start();

    /**
     * Signals the worker to stop, lets it finish the current batch plus one final flush, and waits up to
     * {@code timeout}. A worker still running after that is cancelled.
     */
    void stop(Duration timeout);

    boolean isRunning();

    /** Events dropped since construction. */
    long droppedCount();
}
