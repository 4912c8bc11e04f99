package com.tollgate.executionlog.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/** Payloads of one execution, keyed by the log id. Either side may be null. */
public record ExecutionDetail(UUID id, JsonNode request, JsonNode response) {
}
