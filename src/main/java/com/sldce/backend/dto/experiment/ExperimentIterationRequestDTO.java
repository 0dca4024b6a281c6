package com.sldce.backend.dto.experiment;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record ExperimentIterationRequestDTO(
        @NotNull(message = "iterationNumber is required")
        @Positive(message = "iterationNumber must be greater than zero")
        Integer iterationNumber,

        @NotNull(message = "accuracy is required")
        @DecimalMin(value = "0.0", message = "accuracy must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "accuracy must be between 0 and 1")
        Double accuracy,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double precision,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double recall,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double f1Score,

        @PositiveOrZero
        Integer samplesFlagged,

        @PositiveOrZero
        Integer samplesReviewed,

        @PositiveOrZero
        Integer samplesCorrected,

        @DecimalMin("0.0") @DecimalMax("100.0")
        Double correctionAcceptanceRate,

        @DecimalMin("0.0") @DecimalMax("100.0")
        Double remainingNoisePercentage,

        @PositiveOrZero
        Double iterationTimeSeconds
) {}
