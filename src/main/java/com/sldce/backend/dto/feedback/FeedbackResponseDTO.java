package com.sldce.backend.dto.feedback;

import java.time.LocalDateTime;

import com.sldce.backend.enums.FeedbackAction;

public record FeedbackResponseDTO(
        Long id,
        Long suggestionId,
        Long sampleId,
        Long datasetId,
        FeedbackAction action,
        int finalLabel,
        int iteration,
        Double reviewTimeSeconds,
        LocalDateTime createdAt
) {}
