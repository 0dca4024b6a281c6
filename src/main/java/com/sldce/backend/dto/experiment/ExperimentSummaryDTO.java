package com.sldce.backend.dto.experiment;

public record ExperimentSummaryDTO(
        Long experimentId,
        String name,
        String status,
        int totalIterations,
        double accuracyImprovement,
        double noiseReduction,
        int totalCorrections,
        double avgTimePerIteration
) {}
