package com.sldce.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.feedback.AcceptanceBucketDTO;
import com.sldce.backend.dto.feedback.FeedbackPatternsDTO;
import com.sldce.backend.dto.feedback.FeedbackStatsDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.Feedback;
import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.FeedbackRepository;
import com.sldce.backend.services.detection.PriorityScorer;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    private static final Long DATASET_ID = 5L;

    @Mock
    FeedbackRepository feedbackRepository;

    @Mock
    DatasetRepository datasetRepository;

    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        DetectionProperties properties = DetectionProperties.defaults();
        feedbackService = new FeedbackService(
                feedbackRepository,
                datasetRepository,
                new PriorityScorer(properties),
                properties
        );
    }

    @Test
    void getFeedbackStats_countsAcceptAndModifyAsAccepted() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.countByDatasetIdAndAction(DATASET_ID, FeedbackAction.ACCEPT)).thenReturn(25L);
        when(feedbackRepository.countByDatasetIdAndAction(DATASET_ID, FeedbackAction.REJECT)).thenReturn(8L);
        when(feedbackRepository.countByDatasetIdAndAction(DATASET_ID, FeedbackAction.MODIFY)).thenReturn(2L);

        FeedbackStatsDTO stats = feedbackService.getFeedbackStats(DATASET_ID);

        assertThat(stats.totalFeedback()).isEqualTo(35);
        assertThat(stats.acceptanceRate()).isEqualTo(77.14);
    }

    @Test
    void getFeedbackPatterns_bucketsByConfidenceDecileAndPriorityBand() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.findWithDetectionByDatasetId(DATASET_ID, null)).thenReturn(List.of(
                feedback(1L, 0.95, 0.80, FeedbackAction.ACCEPT),
                feedback(2L, 0.92, 0.75, FeedbackAction.REJECT),
                feedback(3L, 0.72, 0.50, FeedbackAction.MODIFY),
                feedback(4L, 0.78, 0.30, FeedbackAction.ACCEPT)
        ));

        FeedbackPatternsDTO patterns = feedbackService.getFeedbackPatterns(DATASET_ID, null);

        assertThat(patterns.patternsFound()).isEqualTo(4);
        assertThat(patterns.acceptanceByConfidence()).containsOnlyKeys("70%", "90%");
        assertThat(patterns.acceptanceByConfidence().get("70%")).isEqualTo(new AcceptanceBucketDTO(2, 2, 100.0));
        assertThat(patterns.acceptanceByConfidence().get("90%")).isEqualTo(new AcceptanceBucketDTO(2, 1, 50.0));

        assertThat(patterns.acceptanceByPriority()).containsOnlyKeys("high", "medium", "low");
        assertThat(patterns.acceptanceByPriority().get("high").acceptanceRate()).isEqualTo(50.0);
        assertThat(patterns.acceptanceByPriority().get("medium").acceptanceRate()).isEqualTo(100.0);
        assertThat(patterns.acceptanceByPriority().get("low").acceptanceRate()).isEqualTo(100.0);

        assertThat(patterns.insights()).containsExactly(
                "Highest acceptance rate (100%) at 70% confidence",
                "High priority detections accepted 50% of the time"
        );
    }

    @Test
    void getFeedbackPatterns_withoutFeedback_reportsNothingFound() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.findWithDetectionByDatasetId(DATASET_ID, 2)).thenReturn(List.of());

        FeedbackPatternsDTO patterns = feedbackService.getFeedbackPatterns(DATASET_ID, 2);

        assertThat(patterns.patternsFound()).isZero();
        assertThat(patterns.acceptanceByConfidence()).isEmpty();
        assertThat(patterns.acceptanceByPriority()).isEmpty();
        assertThat(patterns.insights()).containsExactly("No feedback available for pattern analysis");
    }

    @Test
    void getFeedbackPatterns_missingDataset_isNotFound() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(false);

        assertThatThrownBy(() -> feedbackService.getFeedbackPatterns(DATASET_ID, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void confidenceDecile_andPriorityBand_boundaries() {
        assertThat(FeedbackService.confidenceDecile(0.7)).isEqualTo(70);
        assertThat(FeedbackService.confidenceDecile(0.999)).isEqualTo(90);
        assertThat(FeedbackService.priorityBand(0.7)).isEqualTo("high");
        assertThat(FeedbackService.priorityBand(0.4)).isEqualTo("medium");
        assertThat(FeedbackService.priorityBand(0.39)).isEqualTo("low");
    }

    private static Feedback feedback(Long id, double confidence, double priority, FeedbackAction action) {
        Detection detection = Detection.builder()
                .id(id)
                .datasetId(DATASET_ID)
                .iteration(1)
                .confidenceScore(confidence)
                .priorityScore(priority)
                .build();
        Suggestion suggestion = Suggestion.builder().id(id).detection(detection).build();
        return Feedback.builder()
                .id(id)
                .suggestion(suggestion)
                .datasetId(DATASET_ID)
                .action(action)
                .iteration(1)
                .build();
    }
}
