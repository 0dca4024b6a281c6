package com.sldce.backend.dto.feedback;

import com.sldce.backend.dto.detection.DetectionResponseDTO;
import com.sldce.backend.dto.suggestion.SuggestionResponseDTO;

public record FeedbackDetailsDTO(
        FeedbackResponseDTO feedback,
        SuggestionResponseDTO suggestion,
        DetectionResponseDTO detection,
        int originalLabel,
        int currentLabel
) {}
