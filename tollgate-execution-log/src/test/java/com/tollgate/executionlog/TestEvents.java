package com.tollgate.executionlog;

import java.time.Instant;
import java.util.UUID;

/** Event fixtures shared by the appender, codec and store tests. */
public final class TestEvents {

    public static final UUID PROJECT = UUID.fromString("5f0c2f0e-6a53-4c1b-9a7e-2d8a1f6b0c11");

    private TestEvents() {
    }

    public static LogEvent event(String functionName) {
        return LogEvent.builder()
                .functionName(functionName)
                .appName("GITHUB")
                .projectId(PROJECT)
                .status(ExecutionStatus.SUCCESS)
                .executionTimeMs(12)
                .createdAt(Instant.parse("2024-04-10T05:00:00Z"))
                .build();
    }
}
