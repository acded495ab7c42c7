package com.healthauth.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of {@link LedgerSnapshot} for caller-supplied storage.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(LedgerSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to encode ledger snapshot", e);
        }
    }

    public LedgerSnapshot decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Snapshot JSON cannot be null or blank");
        }
        try {
            return objectMapper.readValue(json, LedgerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to decode ledger snapshot", e);
        }
    }
}
