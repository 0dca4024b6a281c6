package com.sldce.backend.dto.detection;

public record DetectionStatsDTO(
        Long datasetId,
        long totalSamples,
        long suspiciousSamples,
        long totalDetections,
        long highPriorityDetections,
        double averageConfidence,
        double detectionRate
) {}
