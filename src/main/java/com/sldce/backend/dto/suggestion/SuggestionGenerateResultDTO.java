package com.sldce.backend.dto.suggestion;

public record SuggestionGenerateResultDTO(
        Long datasetId,
        int iteration,
        int suggestionsCreated,
        int totalDetections,
        String message
) {}
