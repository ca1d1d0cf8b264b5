package com.cropadvisory.entity;

import com.cropadvisory.dto.WeatherSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores the weather snapshot taken at recommendation time as a JSON document.
 */
@Slf4j
@Converter
public class WeatherSnapshotConverter implements AttributeConverter<WeatherSnapshot, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    public String convertToDatabaseColumn(WeatherSnapshot attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Weather snapshot is not serializable", ex);
        }
    }

    @Override
    public WeatherSnapshot convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return WeatherSnapshot.empty();
        }
        try {
            return MAPPER.readValue(dbData, WeatherSnapshot.class);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable weather snapshot, using empty snapshot | reason={}", ex.getOriginalMessage());
            return WeatherSnapshot.empty();
        }
    }
}
