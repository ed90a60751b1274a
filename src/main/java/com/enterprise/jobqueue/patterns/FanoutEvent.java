package com.enterprise.jobqueue.patterns;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * A domain event delivered to every handler registered for its type
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class FanoutEvent {

    private final String type;
    private final JsonNode payload;
    private final Map<String, String> metadata;
    private final Instant timestamp;

    @JsonCreator
    public FanoutEvent(@JsonProperty("type") String type,
                       @JsonProperty("payload") JsonNode payload,
                       @JsonProperty("metadata") Map<String, String> metadata,
                       @JsonProperty("timestamp") Instant timestamp) {
        this.type = type;
        this.payload = payload;
        this.metadata = metadata != null ? Collections.unmodifiableMap(metadata) : Collections.emptyMap();
        this.timestamp = timestamp;
    }

    public static FanoutEvent of(String type, JsonNode payload) {
        return new FanoutEvent(type, payload, null, null);
    }

    public String getType() { return type; }
    public JsonNode getPayload() { return payload; }
    public Map<String, String> getMetadata() { return metadata; }
    public Instant getTimestamp() { return timestamp; }

    public FanoutEvent withTimestamp(Instant timestamp) {
        return new FanoutEvent(type, payload, metadata, timestamp);
    }
}
