package com.sldce.backend.mappers;

import com.sldce.backend.dto.feedback.FeedbackResponseDTO;
import com.sldce.backend.entities.Feedback;

public class FeedbackMapper {
    private FeedbackMapper() {}

    public static FeedbackResponseDTO toResponseDTO(Feedback f) {
        if (f == null) return null;

        return new FeedbackResponseDTO(
                f.getId(),
                f.getSuggestion() != null ? f.getSuggestion().getId() : null,
                f.getSample() != null ? f.getSample().getId() : null,
                f.getDatasetId(),
                f.getAction(),
                f.getFinalLabel(),
                f.getIteration(),
                f.getReviewTimeSeconds(),
                f.getCreatedAt()
        );
    }
}
