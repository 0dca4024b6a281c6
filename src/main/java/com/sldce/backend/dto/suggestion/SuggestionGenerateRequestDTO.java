package com.sldce.backend.dto.suggestion;

import jakarta.validation.constraints.NotNull;

public record SuggestionGenerateRequestDTO(
        @NotNull(message = "datasetId is required")
        Long datasetId,
        // latest iteration when absent
        Integer iteration,
        Integer topN
) {}
