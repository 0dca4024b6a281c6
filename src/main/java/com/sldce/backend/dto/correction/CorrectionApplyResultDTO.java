package com.sldce.backend.dto.correction;

import java.time.LocalDateTime;

public record CorrectionApplyResultDTO(
        Long datasetId,
        int iteration,
        int correctionsApplied,
        int labelsChanged,
        int samplesRejected,
        int totalFeedback,
        LocalDateTime timestamp
) {}
