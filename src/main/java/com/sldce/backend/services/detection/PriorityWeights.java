package com.sldce.backend.services.detection;

import com.sldce.backend.exceptions.BadRequestException;

/**
 * Weights of the two signals in the priority score. Each in [0, 1], summing to exactly 1 once constructed.
 */
public record PriorityWeights(double confidenceWeight, double anomalyWeight) {

    static final double SUM_TOLERANCE = 1e-6;

    public static final PriorityWeights DEFAULT = new PriorityWeights(0.6, 0.4);

    public PriorityWeights {
        if (Double.isNaN(confidenceWeight) || confidenceWeight < 0.0 || confidenceWeight > 1.0) {
            throw new BadRequestException("Confidence weight must be between 0 and 1, got " + confidenceWeight);
        }
        if (Double.isNaN(anomalyWeight) || anomalyWeight < 0.0 || anomalyWeight > 1.0) {
            throw new BadRequestException("Anomaly weight must be between 0 and 1, got " + anomalyWeight);
        }
        if (Math.abs(confidenceWeight + anomalyWeight - 1.0) > SUM_TOLERANCE) {
            throw new BadRequestException(
                    "Priority weights must sum to 1, got " + confidenceWeight + " + " + anomalyWeight);
        }
        // absorb the tolerance so a fused priority never exceeds 1
        if (confidenceWeight + anomalyWeight != 1.0) {
            anomalyWeight = 1.0 - confidenceWeight;
        }
    }

    /**
     * A single supplied weight implies its complement; with neither supplied the defaults apply.
     */
    public static PriorityWeights of(Double confidenceWeight, Double anomalyWeight, PriorityWeights defaults) {
        if (confidenceWeight == null && anomalyWeight == null) {
            return defaults;
        }
        if (anomalyWeight == null) {
            return new PriorityWeights(confidenceWeight, 1.0 - confidenceWeight);
        }
        if (confidenceWeight == null) {
            return new PriorityWeights(1.0 - anomalyWeight, anomalyWeight);
        }
        return new PriorityWeights(confidenceWeight, anomalyWeight);
    }
}
