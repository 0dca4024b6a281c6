package com.sldce.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sldce.backend.dto.correction.CorrectionApplyResultDTO;
import com.sldce.backend.dto.correction.CorrectionChangeDTO;
import com.sldce.backend.dto.correction.CorrectionPreviewDTO;
import com.sldce.backend.dto.correction.CorrectionSummaryDTO;
import com.sldce.backend.entities.Feedback;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.FeedbackRepository;
import com.sldce.backend.repositories.SampleRepository;

@ExtendWith(MockitoExtension.class)
class CorrectionServiceTest {

    private static final Long DATASET_ID = 9L;

    @Mock
    DatasetRepository datasetRepository;

    @Mock
    SampleRepository sampleRepository;

    @Mock
    FeedbackRepository feedbackRepository;

    @InjectMocks
    CorrectionService correctionService;

    private Sample relabelled;
    private Sample rejected;
    private Sample alreadyCorrect;
    private List<Feedback> feedback;

    @BeforeEach
    void setUp() {
        relabelled = sample(1L, 0);
        rejected = sample(2L, 1);
        alreadyCorrect = sample(3L, 2);
        feedback = List.of(
                feedback(11L, alreadyCorrect, FeedbackAction.MODIFY, 2),
                feedback(12L, relabelled, FeedbackAction.ACCEPT, 1),
                feedback(13L, rejected, FeedbackAction.REJECT, 1)
        );
    }

    @Test
    void previewCorrections_listsOnlyEffectiveChanges() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.findWithSampleByDatasetIdAndIteration(DATASET_ID, 1)).thenReturn(feedback);
        when(sampleRepository.countByDatasetId(DATASET_ID)).thenReturn(10L);

        CorrectionPreviewDTO preview = correctionService.previewCorrections(DATASET_ID, 1);

        assertThat(preview.totalChanges()).isEqualTo(1);
        assertThat(preview.totalFeedback()).isEqualTo(3);
        assertThat(preview.samplesToReject()).isEqualTo(1);
        assertThat(preview.estimatedNoiseReduction()).isEqualTo(10.0);
        assertThat(preview.changes())
                .containsExactly(new CorrectionChangeDTO(1L, 0, 1, FeedbackAction.ACCEPT));
        assertThat(relabelled.getCurrentLabel()).isZero();
    }

    @Test
    void applyCorrections_changesLabelsAndIsIdempotent() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.findByDatasetIdAndIterationOrderByIdAsc(DATASET_ID, 1)).thenReturn(feedback);
        when(sampleRepository.findAllByIdForUpdate(List.of(3L, 1L))).thenReturn(List.of(relabelled, alreadyCorrect));

        CorrectionApplyResultDTO first = correctionService.applyCorrections(DATASET_ID, 1);

        assertThat(first.labelsChanged()).isEqualTo(1);
        assertThat(first.correctionsApplied()).isEqualTo(2);
        assertThat(first.samplesRejected()).isEqualTo(1);
        assertThat(first.totalFeedback()).isEqualTo(3);
        assertThat(relabelled.getCurrentLabel()).isEqualTo(1);
        assertThat(relabelled.isCorrected()).isTrue();
        assertThat(alreadyCorrect.isCorrected()).isFalse();
        assertThat(relabelled.getOriginalLabel()).isZero();

        CorrectionApplyResultDTO second = correctionService.applyCorrections(DATASET_ID, 1);

        assertThat(second.labelsChanged()).isZero();
        assertThat(second.correctionsApplied()).isEqualTo(2);
        verify(sampleRepository, times(1)).saveAll(any());
    }

    @Test
    void applyCorrections_rejectOnlyFeedback_touchesNothing() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(feedbackRepository.findByDatasetIdAndIterationOrderByIdAsc(DATASET_ID, 2))
                .thenReturn(List.of(feedback(20L, rejected, FeedbackAction.REJECT, 1)));

        CorrectionApplyResultDTO result = correctionService.applyCorrections(DATASET_ID, 2);

        assertThat(result.labelsChanged()).isZero();
        assertThat(result.samplesRejected()).isEqualTo(1);
        verify(sampleRepository, never()).findAllByIdForUpdate(any());
        verify(sampleRepository, never()).saveAll(any());
    }

    @Test
    void applyCorrections_missingDataset_isNotFound() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(false);

        assertThatThrownBy(() -> correctionService.applyCorrections(DATASET_ID, 1))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void previewCorrections_nonPositiveIteration_isValidationError() {
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);

        assertThatThrownBy(() -> correctionService.previewCorrections(DATASET_ID, 0))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void getCorrectionSummary_reportsDistributions() {
        relabelled.setCurrentLabel(1);
        relabelled.setCorrected(true);
        when(datasetRepository.existsById(DATASET_ID)).thenReturn(true);
        when(sampleRepository.findByDatasetIdOrderBySampleIndexAscIdAsc(DATASET_ID))
                .thenReturn(List.of(relabelled, rejected, alreadyCorrect, sample(4L, 1)));

        CorrectionSummaryDTO summary = correctionService.getCorrectionSummary(DATASET_ID);

        assertThat(summary.totalSamples()).isEqualTo(4);
        assertThat(summary.correctedSamples()).isEqualTo(1);
        assertThat(summary.labelsChanged()).isEqualTo(1);
        assertThat(summary.correctionRate()).isEqualTo(25.0);
        assertThat(summary.originalLabelDistribution()).isEqualTo(Map.of(0, 1L, 1, 2L, 2, 1L));
        assertThat(summary.currentLabelDistribution()).isEqualTo(Map.of(1, 3L, 2, 1L));
    }

    private static Sample sample(Long id, int label) {
        return Sample.builder()
                .id(id)
                .sampleIndex(id.intValue())
                .features(List.of(0.1, 0.2))
                .originalLabel(label)
                .currentLabel(label)
                .build();
    }

    private static Feedback feedback(Long id, Sample sample, FeedbackAction action, int finalLabel) {
        return Feedback.builder()
                .id(id)
                .sample(sample)
                .datasetId(DATASET_ID)
                .action(action)
                .finalLabel(finalLabel)
                .iteration(1)
                .build();
    }
}
