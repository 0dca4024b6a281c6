package com.sldce.backend.converters;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a sample's feature vector as a JSON array in a text column.
 */
@Converter
public class FeatureVectorConverter implements AttributeConverter<List<Double>, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<Double>> FEATURES_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Double> features) {
        try {
            return objectMapper.writeValueAsString(features != null ? features : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting feature vector to JSON", e);
        }
    }

    @Override
    public List<Double> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(dbData, FEATURES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting JSON to feature vector", e);
        }
    }
}
