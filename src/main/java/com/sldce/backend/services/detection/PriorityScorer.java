package com.sldce.backend.services.detection;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.enums.SignalType;

import lombok.RequiredArgsConstructor;

/**
 * Signal fusion, suspicion test, ranking and signal classification. Pure functions over already validated scores.
 */
@Component
@RequiredArgsConstructor
public class PriorityScorer {

    /**
     * Higher priority first; equal priorities keep sample id order so reruns rank identically.
     */
    public static final Comparator<ScoredSample> RANKING = Comparator
            .comparingDouble(ScoredSample::priority).reversed()
            .thenComparing(s -> s.sample().getId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private final DetectionProperties detectionProperties;

    public double fuse(double confidence, double anomaly, PriorityWeights weights) {
        return weights.confidenceWeight() * confidence + weights.anomalyWeight() * anomaly;
    }

    // inclusive; the anomaly score plays no part in suspicion
    public boolean isSuspicious(double confidence, double threshold) {
        return confidence >= threshold;
    }

    public List<ScoredSample> rank(List<ScoredSample> suspicious) {
        return suspicious.stream()
                .sorted(RANKING)
                .toList();
    }

    /**
     * A detection may fall into more than one category: dominance and both-high are counted independently.
     */
    public Set<SignalType> classify(double confidence, double anomaly) {
        Set<SignalType> types = EnumSet.noneOf(SignalType.class);
        if (confidence > anomaly) {
            types.add(SignalType.CONFIDENCE_DOMINANT);
        }
        if (anomaly > confidence) {
            types.add(SignalType.ANOMALY_DOMINANT);
        }
        double bothHigh = detectionProperties.bothHighThreshold();
        if (confidence >= bothHigh && anomaly >= bothHigh) {
            types.add(SignalType.BOTH_HIGH);
        }
        return types;
    }
}
