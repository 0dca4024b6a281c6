package com.sldce.backend.dto.detection;

import java.time.LocalDateTime;

public record DetectionRunDTO(
        Long id,
        Long datasetId,
        int iteration,
        double confidenceThreshold,
        double confidenceWeight,
        double anomalyWeight,
        Integer maxSamples,
        int totalSamplesAnalyzed,
        int suspiciousSamplesFound,
        double detectionRate,
        LocalDateTime createdAt
) {}
