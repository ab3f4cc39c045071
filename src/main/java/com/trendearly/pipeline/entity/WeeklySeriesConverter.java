package com.trendearly.pipeline.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores the weekly series as a JSON array column.
 */
@Converter
public class WeeklySeriesConverter implements AttributeConverter<List<Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Double>> SERIES_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Double> series) {
        if (series == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(series);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize weekly series", e);
        }
    }

    @Override
    public List<Double> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, SERIES_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt weekly series column", e);
        }
    }
}
