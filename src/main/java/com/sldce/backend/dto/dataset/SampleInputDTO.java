package com.sldce.backend.dto.dataset;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record SampleInputDTO(
        @NotEmpty(message = "features must not be empty")
        List<@NotNull Double> features,

        @NotNull(message = "label is required")
        Integer label
) {}
