package com.sldce.backend.dto.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record ModelRequestDTO(
        @NotNull(message = "datasetId is required")
        Long datasetId,

        @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must have at most 255 characters")
        String name,

        @NotBlank(message = "modelType is required")
        @Size(max = 100, message = "modelType must have at most 100 characters")
        String modelType,

        String description,

        @NotNull(message = "iteration is required")
        @PositiveOrZero(message = "iteration must not be negative")
        Integer iteration,

        Boolean baseline,

        @DecimalMin(value = "0.0", message = "trainAccuracy must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "trainAccuracy must be between 0 and 1")
        Double trainAccuracy,

        @DecimalMin(value = "0.0", message = "testAccuracy must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "testAccuracy must be between 0 and 1")
        Double testAccuracy,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double precision,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double recall,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double f1Score,

        @PositiveOrZero
        Integer numSamplesTrained,

        @PositiveOrZero
        Integer samplesCorrected,

        @PositiveOrZero
        Double trainingTimeSeconds
) {}
