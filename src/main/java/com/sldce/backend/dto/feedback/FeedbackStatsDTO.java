package com.sldce.backend.dto.feedback;

public record FeedbackStatsDTO(
        Long datasetId,
        long totalFeedback,
        long accepted,
        long rejected,
        long modified,
        double acceptanceRate
) {}
