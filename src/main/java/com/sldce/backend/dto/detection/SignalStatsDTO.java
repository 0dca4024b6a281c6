package com.sldce.backend.dto.detection;

public record SignalStatsDTO(
        Long datasetId,
        Integer iteration,
        long totalDetections,
        long confidenceDominant,
        long anomalyDominant,
        long bothHigh,
        double avgConfidence,
        double avgAnomaly
) {}
