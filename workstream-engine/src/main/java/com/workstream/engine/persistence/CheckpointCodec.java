package com.workstream.engine.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workstream.core.model.RunCheckpoint;

/**
 * JSON encoding of run checkpoints.
 */
public class CheckpointCodec {

    private final ObjectMapper objectMapper;

    public CheckpointCodec() {
        this(defaultObjectMapper());
    }

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(RunCheckpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint of run " + checkpoint.runId(), e);
        }
    }

    public RunCheckpoint decode(String json) {
        try {
            return objectMapper.readValue(json, RunCheckpoint.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint", e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
