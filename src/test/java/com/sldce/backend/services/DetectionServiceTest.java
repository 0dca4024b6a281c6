package com.sldce.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.detection.DetectionRunResultDTO;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.DetectionRun;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.exceptions.UpstreamSignalException;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.DetectionRepository;
import com.sldce.backend.repositories.DetectionRunRepository;
import com.sldce.backend.repositories.SampleRepository;
import com.sldce.backend.services.detection.PriorityScorer;
import com.sldce.backend.services.signals.SignalPrediction;
import com.sldce.backend.services.signals.SignalProvider;

@ExtendWith(MockitoExtension.class)
class DetectionServiceTest {

    private static final Long DATASET_ID = 10L;

    @Mock
    DatasetRepository datasetRepository;

    @Mock
    SampleRepository sampleRepository;

    @Mock
    DetectionRepository detectionRepository;

    @Mock
    DetectionRunRepository detectionRunRepository;

    @Mock
    SignalProvider signalProvider;

    @Captor
    ArgumentCaptor<Iterable<Detection>> detectionsCaptor;

    @Captor
    ArgumentCaptor<DetectionRun> runCaptor;

    private DetectionService service;
    private Dataset dataset;

    @BeforeEach
    void setUp() {
        DetectionProperties properties = DetectionProperties.defaults();
        service = new DetectionService(
                datasetRepository,
                sampleRepository,
                detectionRepository,
                detectionRunRepository,
                signalProvider,
                new PriorityScorer(properties),
                properties
        );
        dataset = Dataset.builder().id(DATASET_ID).name("iris").build();
    }

    @Test
    void runDetection_flagsAtThresholdAndRanksByPriority() {
        Sample s1 = sample(1L, 0);
        Sample s2 = sample(2L, 1);
        Sample s3 = sample(3L, 2);
        givenDatasetWithSamples(s1, s2, s3);
        givenSignals(s1, 1, 0.7, 0.1);
        givenSignals(s2, 0, 0.6999, 0.99);
        givenSignals(s3, 2, 0.9, 0.2);

        DetectionRunResultDTO result = service.runDetection(DATASET_ID, null, null, null, null);

        assertThat(result.iteration()).isEqualTo(1);
        assertThat(result.totalSamplesAnalyzed()).isEqualTo(3);
        assertThat(result.suspiciousSamplesFound()).isEqualTo(2);
        assertThat(result.detectionRate()).isEqualTo(66.67);
        assertThat(result.confidenceThreshold()).isEqualTo(0.7);

        verify(detectionRepository).saveAll(detectionsCaptor.capture());
        List<Detection> detections = new ArrayList<>();
        detectionsCaptor.getValue().forEach(detections::add);
        assertThat(detections).extracting(d -> d.getSample().getId()).containsExactly(3L, 1L);
        assertThat(detections).extracting(Detection::getRank).containsExactly(1, 2);
        assertThat(detections.get(0).getPriorityScore()).isCloseTo(0.62, within(1e-9));
        assertThat(detections.get(0).getConfidenceWeight()).isEqualTo(0.6);
        assertThat(detections.get(0).getAnomalyWeight()).isEqualTo(0.4);

        assertThat(s1.isSuspicious()).isTrue();
        assertThat(s2.isSuspicious()).isFalse();
        assertThat(s3.isSuspicious()).isTrue();
    }

    @Test
    void runDetection_allocatesNextIterationAfterExistingRuns() {
        givenDatasetWithSamples();
        when(detectionRunRepository.findMaxIteration(DATASET_ID)).thenReturn(2);

        DetectionRunResultDTO result = service.runDetection(DATASET_ID, 0.8, 0.5, 0.5, null);

        assertThat(result.iteration()).isEqualTo(3);
        assertThat(result.totalSamplesAnalyzed()).isZero();
        assertThat(result.suspiciousSamplesFound()).isZero();
        assertThat(result.detectionRate()).isZero();

        verify(detectionRunRepository).saveAndFlush(runCaptor.capture());
        assertThat(runCaptor.getValue().getIteration()).isEqualTo(3);
        assertThat(runCaptor.getValue().getConfidenceThreshold()).isEqualTo(0.8);
    }

    @Test
    void runDetection_limitsToMaxSamples() {
        Sample s1 = sample(1L, 0);
        Sample s2 = sample(2L, 0);
        givenDatasetWithSamples(s1, s2);
        givenSignals(s1, 1, 0.95, 0.5);

        DetectionRunResultDTO result = service.runDetection(DATASET_ID, null, null, null, 1);

        assertThat(result.totalSamplesAnalyzed()).isEqualTo(1);
        verify(signalProvider, never()).predict(s2);
    }

    @Test
    void runDetection_upstreamFailure_persistsNothing() {
        Sample s1 = sample(1L, 0);
        Sample s2 = sample(2L, 0);
        givenDatasetWithSamples(s1, s2);
        givenSignals(s1, 1, 0.9, 0.1);
        when(signalProvider.predict(s2)).thenThrow(new IllegalStateException("model not loaded"));

        assertThatThrownBy(() -> service.runDetection(DATASET_ID, null, null, null, null))
                .isInstanceOf(UpstreamSignalException.class)
                .hasMessageContaining("sample 2");

        verify(detectionRunRepository, never()).saveAndFlush(any());
        verify(detectionRepository, never()).saveAll(any());
        assertThat(s1.isSuspicious()).isFalse();
    }

    @Test
    void runDetection_scoreOutOfRange_isUpstreamError() {
        Sample s1 = sample(1L, 0);
        givenDatasetWithSamples(s1);
        givenSignals(s1, 1, 0.9, 1.2);

        assertThatThrownBy(() -> service.runDetection(DATASET_ID, null, null, null, null))
                .isInstanceOf(UpstreamSignalException.class)
                .hasMessageContaining("anomaly");

        verify(detectionRunRepository, never()).saveAndFlush(any());
    }

    @Test
    void runDetection_nanConfidence_isUpstreamError() {
        Sample s1 = sample(1L, 0);
        givenDatasetWithSamples(s1);
        givenSignals(s1, 1, Double.NaN, 0.3);

        assertThatThrownBy(() -> service.runDetection(DATASET_ID, null, null, null, null))
                .isInstanceOf(UpstreamSignalException.class);
    }

    @Test
    void runDetection_invalidWeights_failsBeforeTouchingStorage() {
        assertThatThrownBy(() -> service.runDetection(DATASET_ID, 0.7, 0.5, 0.6, null))
                .isInstanceOf(BadRequestException.class);

        verifyNoInteractions(datasetRepository, sampleRepository, signalProvider);
    }

    @Test
    void runDetection_thresholdOutOfRange_isValidationError() {
        assertThatThrownBy(() -> service.runDetection(DATASET_ID, 1.5, null, null, null))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("threshold");
    }

    @Test
    void runDetection_missingDataset_isNotFound() {
        when(datasetRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.runDetection(99L, null, null, null, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("99");
    }

    private void givenDatasetWithSamples(Sample... samples) {
        when(datasetRepository.findByIdForUpdate(DATASET_ID)).thenReturn(Optional.of(dataset));
        when(sampleRepository.findByDatasetIdOrderBySampleIndexAscIdAsc(DATASET_ID)).thenReturn(List.of(samples));
    }

    private void givenSignals(Sample sample, int predictedLabel, double confidence, double anomaly) {
        when(signalProvider.predict(sample)).thenReturn(new SignalPrediction(predictedLabel, confidence));
        when(signalProvider.anomalyScore(sample)).thenReturn(anomaly);
    }

    private Sample sample(Long id, int label) {
        return Sample.builder()
                .id(id)
                .dataset(dataset)
                .sampleIndex(id.intValue() - 1)
                .features(List.of(0.1, 0.2))
                .originalLabel(label)
                .currentLabel(label)
                .build();
    }
}
