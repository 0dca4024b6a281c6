package com.sldce.backend.dto.detection;

import jakarta.validation.constraints.NotNull;

/**
 * Omitted values fall back to the configured detection defaults.
 */
public record DetectionRunRequestDTO(
        @NotNull(message = "datasetId is required")
        Long datasetId,
        Double confidenceThreshold,
        Double confidenceWeight,
        Double anomalyWeight,
        Integer maxSamples
) {}
