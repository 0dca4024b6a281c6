package com.sldce.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for detection requests. Values sent with a request always take precedence.
 */
@ConfigurationProperties(prefix = "sldce.detection")
public record DetectionProperties(
        Double defaultConfidenceThreshold,
        Double defaultConfidenceWeight,
        Double defaultAnomalyWeight,
        Double bothHighThreshold,
        Double highPriorityThreshold,
        Integer defaultListLimit
) {
    public DetectionProperties {
        if (defaultConfidenceThreshold == null) {
            defaultConfidenceThreshold = 0.7;
        }
        if (defaultConfidenceWeight == null) {
            defaultConfidenceWeight = 0.6;
        }
        if (defaultAnomalyWeight == null) {
            defaultAnomalyWeight = 0.4;
        }
        if (bothHighThreshold == null) {
            bothHighThreshold = 0.7;
        }
        if (highPriorityThreshold == null) {
            highPriorityThreshold = 0.8;
        }
        if (defaultListLimit == null || defaultListLimit <= 0) {
            defaultListLimit = 100;
        }
    }

    public static DetectionProperties defaults() {
        return new DetectionProperties(null, null, null, null, null, null);
    }
}
