package com.tollgate.executionlog.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExecutionLogQueryTest {

    private final UUID project = UUID.randomUUID();

    @Test
    void projectOnly_byDefault() {
        ExecutionLogQuery query = ExecutionLogQuery.forProject(project).appName("  ").build();

        assertEquals("WHERE project_id = ?", query.whereClause());
        assertEquals(List.of(project), query.parameters());
        assertEquals(ExecutionLogQuery.DEFAULT_LIMIT, query.getLimit());
        assertEquals(0, query.getOffset());
    }

    @Test
    void filters_appendInFixedOrderWithMatchingParameters() {
        UUID config = UUID.randomUUID();
        Instant start = Instant.parse("2024-04-01T00:00:00Z");
        ExecutionLogQuery query = ExecutionLogQuery.forProject(project)
                .apiKeyName("default")
                .functionName("GITHUB__STAR_REPO")
                .startTime(start)
                .appConfigurationId(config)
                .build();

        assertEquals("WHERE project_id = ? AND created_at >= ? AND function_name = ? AND app_configuration_id = ? AND api_key_name = ?",
                query.whereClause());
        assertEquals(List.of(project, start.atOffset(ZoneOffset.UTC), "GITHUB__STAR_REPO", config, "default"), query.parameters());
    }

    @Test
    void paging_isValidated() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionLogQuery.forProject(project).limit(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionLogQuery.forProject(project).limit(1001).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionLogQuery.forProject(project).offset(-1).build());
        assertThrows(NullPointerException.class, () -> ExecutionLogQuery.forProject(null).build());
    }
}
