package com.sldce.backend.dto.correction;

import com.sldce.backend.enums.FeedbackAction;

public record CorrectionChangeDTO(
        Long sampleId,
        int oldLabel,
        int newLabel,
        FeedbackAction action
) {}
