package com.madisonmentions.backend.reporter.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores article topics as a JSON array.
 */
@Slf4j
@Converter
public class TopicListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> TOPICS = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> topics) {
        if (topics == null || topics.isEmpty()) {
            return "[]";
        }
        try {
            return MAPPER.writeValueAsString(topics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize topics", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(MAPPER.readValue(json, TOPICS));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable topics column '{}': {}", json, e.getMessage());
            return new ArrayList<>();
        }
    }
}
