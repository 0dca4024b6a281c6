package com.sldce.backend.services.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.exceptions.BadRequestException;

class PriorityWeightsTest {

    private final PriorityScorer scorer = new PriorityScorer(DetectionProperties.defaults());

    @Test
    void acceptsWeightsSummingToOneWithinTolerance() {
        PriorityWeights weights = new PriorityWeights(0.7, 0.3 + 5e-7);

        assertThat(weights.confidenceWeight()).isEqualTo(0.7);
        assertThat(weights.anomalyWeight()).isCloseTo(0.3, within(1e-12));
        assertThat(weights.confidenceWeight() + weights.anomalyWeight()).isEqualTo(1.0);
    }

    @Test
    void fuse_atToleranceEdge_neverExceedsOne() {
        PriorityWeights over = new PriorityWeights(0.7, 0.3 + 5e-7);
        PriorityWeights overLowConfidence = new PriorityWeights(0.3, 0.7 + 9e-7);
        PriorityWeights under = new PriorityWeights(0.6, 0.4 - 9e-7);

        assertThat(scorer.fuse(1.0, 1.0, over)).isLessThanOrEqualTo(1.0);
        assertThat(scorer.fuse(1.0, 1.0, overLowConfidence)).isLessThanOrEqualTo(1.0);
        assertThat(scorer.fuse(1.0, 1.0, under)).isLessThanOrEqualTo(1.0).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void exactWeightsAreKeptAsGiven() {
        PriorityWeights weights = new PriorityWeights(0.3, 0.7);

        assertThat(weights.confidenceWeight()).isEqualTo(0.3);
        assertThat(weights.anomalyWeight()).isEqualTo(0.7);
    }

    @Test
    void rejectsWeightsNotSummingToOne() {
        assertThatThrownBy(() -> new PriorityWeights(0.5, 0.4))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("sum to 1");
    }

    @Test
    void rejectsWeightOutsideUnitInterval() {
        assertThatThrownBy(() -> new PriorityWeights(1.2, -0.2))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void of_fillsMissingValuesFromDefaults() {
        PriorityWeights weights = PriorityWeights.of(null, null, PriorityWeights.DEFAULT);

        assertThat(weights).isEqualTo(new PriorityWeights(0.6, 0.4));
    }

    @Test
    void of_singleConfidenceWeight_derivesAnomalyComplement() {
        PriorityWeights weights = PriorityWeights.of(0.7, null, PriorityWeights.DEFAULT);

        assertThat(weights.confidenceWeight()).isEqualTo(0.7);
        assertThat(weights.anomalyWeight()).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void of_singleAnomalyWeight_derivesConfidenceComplement() {
        PriorityWeights weights = PriorityWeights.of(null, 0.25, PriorityWeights.DEFAULT);

        assertThat(weights.confidenceWeight()).isEqualTo(0.75);
        assertThat(weights.anomalyWeight()).isEqualTo(0.25);
    }

    @Test
    void of_singleWeightOutOfRange_isRejected() {
        assertThatThrownBy(() -> PriorityWeights.of(1.5, null, PriorityWeights.DEFAULT))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Confidence weight");
    }
}
