package com.enterprise.jobqueue.core;

import com.enterprise.jobqueue.exception.SerializationFailedException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON codec for task payloads and stored task records
 */
public class TaskCodec {
    
    private final ObjectMapper objectMapper;
    
    public TaskCodec() {
        this(defaultObjectMapper());
    }
    
    public TaskCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    public byte[] encodePayload(Object payload) throws SerializationFailedException {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new SerializationFailedException("Failed to serialize payload of type "
                + (payload != null ? payload.getClass().getName() : "null"), e);
        }
    }
    
    public <T> T decodePayload(byte[] payload, Class<T> type) throws SerializationFailedException {
        try {
            return objectMapper.readValue(payload, type);
        } catch (IOException e) {
            throw new SerializationFailedException("Failed to deserialize payload into " + type.getSimpleName(), e);
        }
    }
    
    public byte[] encodeTask(Task task) throws SerializationFailedException {
        try {
            return objectMapper.writeValueAsBytes(task);
        } catch (IOException e) {
            throw new SerializationFailedException("Failed to serialize task " + task.getId(), e);
        }
    }
    
    public Task decodeTask(byte[] record) throws SerializationFailedException {
        try {
            return objectMapper.readValue(record, TaskImpl.class);
        } catch (IOException e) {
            throw new SerializationFailedException("Failed to deserialize task record", e);
        }
    }
    
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
