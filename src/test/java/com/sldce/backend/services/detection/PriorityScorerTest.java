package com.sldce.backend.services.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.enums.SignalType;

class PriorityScorerTest {

    private final PriorityScorer scorer = new PriorityScorer(DetectionProperties.defaults());

    @Test
    void fuse_isWeightedSumOfSignals() {
        double priority = scorer.fuse(0.9, 0.2, PriorityWeights.DEFAULT);

        assertThat(priority).isCloseTo(0.62, within(1e-9));
    }

    @Test
    void fuse_staysInUnitIntervalForExtremeInputs() {
        PriorityWeights weights = new PriorityWeights(0.3, 0.7);

        assertThat(scorer.fuse(0.0, 0.0, weights)).isEqualTo(0.0);
        assertThat(scorer.fuse(1.0, 1.0, weights)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.fuse(1.0, 0.0, weights)).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void isSuspicious_thresholdIsInclusiveAndIgnoresAnomaly() {
        assertThat(scorer.isSuspicious(0.7, 0.7)).isTrue();
        assertThat(scorer.isSuspicious(0.7 - 1e-9, 0.7)).isFalse();
        assertThat(scorer.isSuspicious(0.0, 0.0)).isTrue();
        assertThat(scorer.isSuspicious(1.0, 1.0)).isTrue();
    }

    @Test
    void rank_ordersByPriorityThenSampleId() {
        ScoredSample a = scored(5L, 0.62);
        ScoredSample b = scored(2L, 0.80);
        ScoredSample c = scored(1L, 0.62);
        ScoredSample d = scored(9L, 0.10);

        List<ScoredSample> ranked = scorer.rank(List.of(a, b, c, d));

        assertThat(ranked).extracting(s -> s.sample().getId()).containsExactly(2L, 1L, 5L, 9L);
    }

    @Test
    void rank_isDeterministicRegardlessOfInputOrder() {
        ScoredSample a = scored(3L, 0.5);
        ScoredSample b = scored(4L, 0.5);
        ScoredSample c = scored(1L, 0.9);

        assertThat(scorer.rank(List.of(a, b, c))).isEqualTo(scorer.rank(List.of(c, b, a)));
    }

    @Test
    void classify_countsDominanceAndBothHighIndependently() {
        assertThat(scorer.classify(0.9, 0.75))
                .containsExactlyInAnyOrder(SignalType.CONFIDENCE_DOMINANT, SignalType.BOTH_HIGH);
        assertThat(scorer.classify(0.2, 0.6)).containsExactly(SignalType.ANOMALY_DOMINANT);
        assertThat(scorer.classify(0.7, 0.7)).containsExactly(SignalType.BOTH_HIGH);
        assertThat(scorer.classify(0.5, 0.5)).isEqualTo(Set.of());
    }

    private static ScoredSample scored(Long sampleId, double priority) {
        Sample sample = Sample.builder().id(sampleId).build();
        return new ScoredSample(sample, 0, priority, priority, priority);
    }
}
