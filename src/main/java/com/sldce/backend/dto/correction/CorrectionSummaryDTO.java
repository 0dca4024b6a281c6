package com.sldce.backend.dto.correction;

import java.util.Map;

public record CorrectionSummaryDTO(
        Long datasetId,
        long totalSamples,
        long correctedSamples,
        long labelsChanged,
        long suspiciousSamples,
        double correctionRate,
        double noiseReduction,
        Map<Integer, Long> originalLabelDistribution,
        Map<Integer, Long> currentLabelDistribution
) {}
