package com.sldce.backend.dto.suggestion;

import java.time.LocalDateTime;

import com.sldce.backend.enums.SuggestionStatus;

public record SuggestionResponseDTO(
        Long id,
        Long detectionId,
        Long sampleId,
        int suggestedLabel,
        String reason,
        double confidence,
        SuggestionStatus status,
        LocalDateTime reviewedAt,
        String reviewerNotes,
        Integer customLabel,
        LocalDateTime createdAt
) {}
