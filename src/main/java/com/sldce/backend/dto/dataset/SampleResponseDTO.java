package com.sldce.backend.dto.dataset;

import java.time.LocalDateTime;
import java.util.List;

public record SampleResponseDTO(
        Long id,
        Long datasetId,
        int sampleIndex,
        List<Double> features,
        int originalLabel,
        int currentLabel,
        boolean suspicious,
        boolean corrected,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
