package com.enterprise.jobqueue.examples;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public final class ArchiveOrderPayload {

    private final UUID orderId;

    @JsonCreator
    public ArchiveOrderPayload(@JsonProperty("order_id") UUID orderId) {
        this.orderId = orderId;
    }

    @JsonProperty("order_id")
    public UUID getOrderId() {
        return orderId;
    }
}
