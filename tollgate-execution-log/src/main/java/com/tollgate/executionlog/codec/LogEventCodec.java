package com.tollgate.executionlog.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tollgate.executionlog.ExecutionStatus;
import com.tollgate.executionlog.LogEvent;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * JSON form of a {@link LogEvent} as stored in the external queue: one flat object with snake_case fields,
 * {@code created_at} as an ISO-8601 instant, absent optionals written as {@code null}.
 */
public final class LogEventCodec {

    static final String ID = "id";
    static final String FUNCTION_NAME = "function_name";
    static final String APP_NAME = "app_name";
    static final String LINKED_ACCOUNT_OWNER_ID = "linked_account_owner_id";
    static final String APP_CONFIGURATION_ID = "app_configuration_id";
    static final String API_KEY_NAME = "api_key_name";
    static final String STATUS = "status";
    static final String EXECUTION_TIME = "execution_time";
    static final String CREATED_AT = "created_at";
    static final String PROJECT_ID = "project_id";
    static final String REQUEST = "request";
    static final String RESPONSE = "response";

    private final ObjectMapper mapper;

    public LogEventCodec() {
        this(new ObjectMapper());
    }

    public LogEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(LogEvent event) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put(ID, event.getId().toString());
        node.put(FUNCTION_NAME, event.getFunctionName());
        node.put(APP_NAME, event.getAppName());
        node.put(LINKED_ACCOUNT_OWNER_ID, event.getLinkedAccountOwnerId());
        node.put(APP_CONFIGURATION_ID, event.getAppConfigurationId() != null ? event.getAppConfigurationId().toString() : null);
        node.put(API_KEY_NAME, event.getApiKeyName());
        node.put(STATUS, event.getStatus().name());
        node.put(EXECUTION_TIME, event.getExecutionTimeMs());
        node.put(CREATED_AT, event.getCreatedAt().toString());
        node.put(PROJECT_ID, event.getProjectId().toString());
        node.set(REQUEST, event.getRequest());
        node.set(RESPONSE, event.getResponse());
        return mapper.writeValueAsString(node);
    }

    /**
     * @throws MalformedLogEventException when the text is not JSON or a required field is missing or invalid
     */
    public LogEvent decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedLogEventException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedLogEventException("Expected a JSON object", null);
        }
        try {
            return LogEvent.builder()
                    .id(UUID.fromString(required(root, ID)))
                    .functionName(required(root, FUNCTION_NAME))
                    .appName(required(root, APP_NAME))
                    .projectId(UUID.fromString(required(root, PROJECT_ID)))
                    .status(ExecutionStatus.valueOf(required(root, STATUS)))
                    .executionTimeMs(root.path(EXECUTION_TIME).asLong(0L))
                    .createdAt(Instant.parse(required(root, CREATED_AT)))
                    .linkedAccountOwnerId(optional(root, LINKED_ACCOUNT_OWNER_ID))
                    .appConfigurationId(optionalUuid(root, APP_CONFIGURATION_ID))
                    .apiKeyName(optional(root, API_KEY_NAME))
                    .request(payload(root, REQUEST))
                    .response(payload(root, RESPONSE))
                    .build();
        } catch (MalformedLogEventException e) {
            throw e;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new MalformedLogEventException(e.getMessage(), e);
        }
    }

    private static String required(JsonNode root, String field) {
        String value = optional(root, field);
        if (value == null || value.isBlank()) {
            throw new MalformedLogEventException("Missing field " + field, null);
        }
        return value;
    }

    private static String optional(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    private static UUID optionalUuid(JsonNode root, String field) {
        String value = optional(root, field);
        return value != null ? UUID.fromString(value) : null;
    }

    private static JsonNode payload(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n;
    }
}
