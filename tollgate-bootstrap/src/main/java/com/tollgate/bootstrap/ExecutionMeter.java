package com.tollgate.bootstrap;

import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.LogEvent;
import com.tollgate.quota.QuotaLedger;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-path glue: charge the project's quota for an execution, then hand its log event to the appender.
 */
public final class ExecutionMeter {

    private final QuotaLedger quotaLedger;
    private final LogAppender appender;

    public ExecutionMeter(QuotaLedger quotaLedger, LogAppender appender) {
        this.quotaLedger = Objects.requireNonNull(quotaLedger, "quotaLedger");
        this.appender = Objects.requireNonNull(appender, "appender");
    }

    /**
     * Charges {@code quotaUnits} to the event's project and enqueues the event. Quota exceptions propagate
     * and the event is then not logged; a dropped event does not undo the charge.
     *
     * @return the log id, or empty when the appender dropped the event
     */
    public Optional<UUID> record(LogEvent event, int quotaUnits) {
        quotaLedger.consume(event.getProjectId(), quotaUnits);
        return appender.enqueue(event);
    }
}
