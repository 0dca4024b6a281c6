package com.sldce.backend.dto.detection;

import java.time.LocalDateTime;

import com.sldce.backend.services.detection.PriorityWeights;

public record DetectionRunResultDTO(
        Long datasetId,
        int iteration,
        int totalSamplesAnalyzed,
        int suspiciousSamplesFound,
        double detectionRate,
        double confidenceThreshold,
        PriorityWeights priorityWeights,
        LocalDateTime timestamp
) {}
