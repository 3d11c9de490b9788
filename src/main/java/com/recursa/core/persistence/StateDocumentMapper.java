package com.recursa.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * JSON (de)serialization of {@link PersistedTaskState} documents, shared by all stores.
 */
public final class StateDocumentMapper {

    private final ObjectMapper objectMapper;

    public StateDocumentMapper() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String write(PersistedTaskState state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize state of task " + state.taskId(), e);
        }
    }

    public PersistedTaskState read(String json) {
        try {
            return objectMapper.readValue(json, PersistedTaskState.class);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to deserialize task state", e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
