package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fileflow.domain.exception.StorageUnavailableException;
import io.vertx.core.buffer.Buffer;

import java.io.IOException;

/**
 * Encodes and decodes persisted documents.
 * Field names are snake_case; unknown keys are dropped on read; dates are ISO-8601 strings.
 */
public class DocumentCodec {

    private final ObjectMapper mapper;

    public DocumentCodec() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public <T> Buffer encode(JsonDocument<T> document, T value) {
        try {
            return Buffer.buffer(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Failed to encode " + document.path(), e);
        }
    }

    /**
     * Blank content decodes to the document's empty value. No sanitizer is applied here.
     */
    public <T> T decode(JsonDocument<T> document, Buffer buffer) {
        if (buffer == null || buffer.toString().isBlank()) {
            return document.empty().get();
        }
        try {
            T value = mapper.readValue(buffer.getBytes(), document.type());
            if (value == null) {
                return document.empty().get();
            }
            return value;
        } catch (IOException e) {
            throw new StorageUnavailableException("Corrupt document " + document.path() + ": " + e.getMessage(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
