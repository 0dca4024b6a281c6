package com.sldce.backend.services.detection;

import com.sldce.backend.entities.Sample;

public record ScoredSample(
        Sample sample,
        int predictedLabel,
        double confidence,
        double anomaly,
        double priority
) {
}
