package com.sldce.backend.dto.model;

import java.time.LocalDateTime;

public record ModelResponseDTO(
        Long id,
        Long datasetId,
        String name,
        String modelType,
        String description,
        int iteration,
        boolean baseline,
        Double trainAccuracy,
        Double testAccuracy,
        Double precision,
        Double recall,
        Double f1Score,
        Integer numSamplesTrained,
        Integer samplesCorrected,
        Double trainingTimeSeconds,
        boolean active,
        LocalDateTime createdAt
) {}
