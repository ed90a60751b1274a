package com.enterprise.jobqueue.idempotency;

import com.enterprise.jobqueue.core.Task;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Derives the idempotency key of a task. An empty key disables the check for that task.
 */
@FunctionalInterface
public interface KeyExtractor {
    
    String extract(Task task);
    
    /**
     * The task id, stable across retries of the same task
     */
    static KeyExtractor taskId() {
        return Task::getId;
    }
    
    /**
     * "{type}:{field}" taken from a top-level field of the JSON payload, empty when the field is absent
     */
    static KeyExtractor payloadField(ObjectMapper objectMapper, String field) {
        return task -> {
            try {
                JsonNode value = objectMapper.readTree(task.getPayload()).get(field);
                if (value == null || value.isNull() || value.asText().isEmpty()) {
                    return "";
                }
                return task.getType() + ":" + value.asText();
            } catch (IOException e) {
                // unparseable payloads run unguarded, the handler reports the bad payload itself
                return "";
            }
        };
    }
}
