package com.sldce.backend.dto.experiment;

import java.time.LocalDateTime;

public record ExperimentResponseDTO(
        Long id,
        Long datasetId,
        String name,
        String description,
        String status,
        double noisePercentage,
        double detectionThreshold,
        int maxIterations,
        int currentIteration,
        Double baselineAccuracy,
        Double finalAccuracy,
        int totalCorrections,
        Double totalTimeSeconds,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime completedAt
) {}
