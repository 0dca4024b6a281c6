package com.sldce.backend.dto.experiment;

import java.time.LocalDateTime;

public record ExperimentIterationResponseDTO(
        Long id,
        Long experimentId,
        int iterationNumber,
        double accuracy,
        Double precision,
        Double recall,
        Double f1Score,
        int samplesFlagged,
        int samplesReviewed,
        int samplesCorrected,
        Double correctionAcceptanceRate,
        Double remainingNoisePercentage,
        Double iterationTimeSeconds,
        LocalDateTime createdAt
) {}
