package com.tollgate.executionlog.appender;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/** Counters of one appender instance, tagged with its implementation id. */
final class AppenderMetrics {

    static final String PREFIX = "tollgate.execution_log.";

    final Counter enqueued;
    final Counter dropped;
    final Counter flushed;
    final Counter flushFailures;
    final Counter malformed;

    AppenderMetrics(MeterRegistry registry, String implementation) {
        this.enqueued = counter(registry, "enqueued", implementation);
        this.dropped = counter(registry, "dropped", implementation);
        this.flushed = counter(registry, "flushed", implementation);
        this.flushFailures = counter(registry, "flush_failures", implementation);
        this.malformed = counter(registry, "malformed", implementation);
    }

    private static Counter counter(MeterRegistry registry, String name, String implementation) {
        return Counter.builder(PREFIX + name)
                .tag("implementation", implementation)
                .register(registry);
    }
}
