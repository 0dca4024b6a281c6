package com.sldce.backend.dto.detection;

import java.time.LocalDateTime;
import java.util.Set;

import com.sldce.backend.enums.SignalType;

public record DetectionResponseDTO(
        Long id,
        Long sampleId,
        Long datasetId,
        int iteration,
        double confidenceScore,
        double anomalyScore,
        double priorityScore,
        int predictedLabel,
        int rank,
        double confidenceWeight,
        double anomalyWeight,
        Set<SignalType> signalTypes,
        LocalDateTime detectedAt
) {}
