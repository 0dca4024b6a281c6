package com.sldce.backend.dto.suggestion;

import java.util.List;

public record SuggestionDetailsDTO(
        SuggestionResponseDTO suggestion,
        int iteration,
        int predictedLabel,
        int currentLabel,
        int originalLabel,
        double confidenceScore,
        double anomalyScore,
        double priorityScore,
        List<Double> sampleFeatures
) {}
