package com.sldce.backend.dto.dataset;

import java.time.LocalDateTime;

public record DatasetResponseDTO(
        Long id,
        String name,
        String description,
        int numSamples,
        int numFeatures,
        int numClasses,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
