package com.tollgate.bootstrap;

import com.tollgate.executionlog.ExecutionStatus;
import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.LogEvent;
import com.tollgate.quota.MonthlyQuotaExceededException;
import com.tollgate.quota.QuotaLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionMeterTest {

    @Mock
    private QuotaLedger ledger;
    @Mock
    private LogAppender appender;

    private final UUID project = UUID.randomUUID();

    private LogEvent event() {
        return LogEvent.builder()
                .functionName("GITHUB__STAR_REPO")
                .appName("GITHUB")
                .projectId(project)
                .status(ExecutionStatus.SUCCESS)
                .executionTimeMs(4)
                .build();
    }

    @Test
    void record_chargesQuotaThenEnqueues() {
        LogEvent event = event();
        when(appender.enqueue(event)).thenReturn(Optional.of(event.getId()));

        assertEquals(Optional.of(event.getId()), new ExecutionMeter(ledger, appender).record(event, 1));

        InOrder order = inOrder(ledger, appender);
        order.verify(ledger).consume(project, 1);
        order.verify(appender).enqueue(event);
    }

    @Test
    void record_rejectedChargeIsNotLogged() {
        doThrow(new MonthlyQuotaExceededException(project, 1, 100, 100)).when(ledger).consume(project, 1);

        assertThrows(MonthlyQuotaExceededException.class, () -> new ExecutionMeter(ledger, appender).record(event(), 1));

        verify(appender, never()).enqueue(any());
    }
}
