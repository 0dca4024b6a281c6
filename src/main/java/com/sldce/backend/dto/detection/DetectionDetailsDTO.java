package com.sldce.backend.dto.detection;

import java.util.List;

public record DetectionDetailsDTO(
        DetectionResponseDTO detection,
        int sampleIndex,
        List<Double> features,
        int originalLabel,
        int currentLabel,
        boolean suspicious,
        boolean corrected
) {}
