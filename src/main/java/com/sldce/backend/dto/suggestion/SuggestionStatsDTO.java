package com.sldce.backend.dto.suggestion;

public record SuggestionStatsDTO(
        Long datasetId,
        long total,
        long pending,
        long accepted,
        long rejected,
        long modified,
        long reviewed,
        double acceptanceRate
) {}
