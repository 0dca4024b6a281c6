package com.sldce.backend.dto.dataset;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record DatasetRequestDTO(
        @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must have at most 255 characters")
        String name,

        String description,

        @NotEmpty(message = "samples must not be empty")
        List<@Valid SampleInputDTO> samples
) {}
