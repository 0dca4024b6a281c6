package com.sldce.backend.mappers;

import com.sldce.backend.dto.suggestion.SuggestionResponseDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.Suggestion;

public class SuggestionMapper {
    private SuggestionMapper() {}

    public static SuggestionResponseDTO toResponseDTO(Suggestion s) {
        if (s == null) return null;

        Detection detection = s.getDetection();
        Long sampleId = detection != null && detection.getSample() != null ? detection.getSample().getId() : null;

        return new SuggestionResponseDTO(
                s.getId(),
                detection != null ? detection.getId() : null,
                sampleId,
                s.getSuggestedLabel(),
                s.getReason(),
                s.getConfidence(),
                s.getStatus(),
                s.getReviewedAt(),
                s.getReviewerNotes(),
                s.getCustomLabel(),
                s.getCreatedAt()
        );
    }
}
