package com.sldce.backend.dto.model;

import java.time.LocalDateTime;

public record ModelComparisonEntryDTO(
        Long id,
        String name,
        String modelType,
        int iteration,
        boolean baseline,
        double accuracy,
        Double f1Score,
        Integer samplesCorrected,
        LocalDateTime createdAt
) {}
