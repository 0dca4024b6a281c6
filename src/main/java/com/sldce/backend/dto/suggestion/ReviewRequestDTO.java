package com.sldce.backend.dto.suggestion;

import com.sldce.backend.enums.FeedbackAction;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record ReviewRequestDTO(
        @NotNull(message = "action is required")
        FeedbackAction action,

        // required when action is MODIFY
        Integer customLabel,

        @Size(max = 2000, message = "reviewerNotes must have at most 2000 characters")
        String reviewerNotes,

        @PositiveOrZero(message = "reviewTimeSeconds must not be negative")
        Double reviewTimeSeconds
) {}
