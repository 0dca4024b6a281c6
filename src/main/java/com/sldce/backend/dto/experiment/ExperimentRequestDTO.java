package com.sldce.backend.dto.experiment;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record ExperimentRequestDTO(
        @NotNull(message = "datasetId is required")
        Long datasetId,

        @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must have at most 255 characters")
        String name,

        String description,

        @NotNull(message = "noisePercentage is required")
        @DecimalMin(value = "0.0", message = "noisePercentage must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "noisePercentage must be between 0 and 100")
        Double noisePercentage,

        @DecimalMin(value = "0.0", message = "detectionThreshold must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "detectionThreshold must be between 0 and 1")
        Double detectionThreshold,

        @Positive(message = "maxIterations must be greater than zero")
        @Max(value = 1000, message = "maxIterations must be at most 1000")
        Integer maxIterations
) {}
