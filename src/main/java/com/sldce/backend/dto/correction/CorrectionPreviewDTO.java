package com.sldce.backend.dto.correction;

import java.util.List;

public record CorrectionPreviewDTO(
        Long datasetId,
        int iteration,
        int totalChanges,
        int totalFeedback,
        int samplesToReject,
        double estimatedNoiseReduction,
        List<CorrectionChangeDTO> changes
) {}
