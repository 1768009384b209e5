package com.seasonalesd.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts a {@link BatchResult} to JSON. Instants are written as ISO-8601
 * strings.
 */
public class ReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializer.class);

    private final boolean prettyPrint;

    private ObjectMapper mapper;

    public ReportSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    /**
     * @param result the batch result
     * @return JSON text
     * @throws IllegalStateException if the result cannot be serialized
     */
    public String serialize(BatchResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return objectMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize batch result: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize batch result", e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            mapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
        }
        return mapper;
    }
}
