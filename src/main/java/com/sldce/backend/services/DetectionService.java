package com.sldce.backend.services;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.detection.DetectionDetailsDTO;
import com.sldce.backend.dto.detection.DetectionResponseDTO;
import com.sldce.backend.dto.detection.DetectionRunDTO;
import com.sldce.backend.dto.detection.DetectionRunResultDTO;
import com.sldce.backend.dto.detection.DetectionStatsDTO;
import com.sldce.backend.dto.detection.SignalStatsDTO;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.DetectionRun;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.enums.SignalType;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.exceptions.UpstreamSignalException;
import com.sldce.backend.mappers.DetectionMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.DetectionRepository;
import com.sldce.backend.repositories.DetectionRunRepository;
import com.sldce.backend.repositories.SampleRepository;
import com.sldce.backend.services.detection.PriorityScorer;
import com.sldce.backend.services.detection.PriorityWeights;
import com.sldce.backend.services.detection.ScoredSample;
import com.sldce.backend.services.signals.SignalPrediction;
import com.sldce.backend.services.signals.SignalProvider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DetectionService {

    private final DatasetRepository datasetRepository;
    private final SampleRepository sampleRepository;
    private final DetectionRepository detectionRepository;
    private final DetectionRunRepository detectionRunRepository;
    private final SignalProvider signalProvider;
    private final PriorityScorer priorityScorer;
    private final DetectionProperties detectionProperties;

    /**
     * Null arguments take the configured defaults. Nothing is persisted unless every sample was scored.
     */
    @Auditable(action = "DETECTION_RUN", entityType = "Dataset")
    @Transactional
    public DetectionRunResultDTO runDetection(
            Long datasetId,
            Double confidenceThreshold,
            Double confidenceWeight,
            Double anomalyWeight,
            Integer maxSamples
    ) {
        double threshold = confidenceThreshold != null
                ? confidenceThreshold
                : detectionProperties.defaultConfidenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new BadRequestException("Confidence threshold must be between 0 and 1, got " + threshold);
        }
        PriorityWeights weights = PriorityWeights.of(confidenceWeight, anomalyWeight, defaultWeights());
        if (maxSamples != null && maxSamples <= 0) {
            throw new BadRequestException("maxSamples must be greater than zero, got " + maxSamples);
        }

        Dataset dataset = datasetRepository.findByIdForUpdate(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("Dataset " + datasetId + " not found"));

        Integer lastIteration = detectionRunRepository.findMaxIteration(datasetId);
        int iteration = lastIteration == null ? 1 : lastIteration + 1;

        List<Sample> samples = sampleRepository.findByDatasetIdOrderBySampleIndexAscIdAsc(datasetId);
        if (maxSamples != null && samples.size() > maxSamples) {
            samples = samples.subList(0, maxSamples);
        }

        log.info("Detection iteration {} on dataset {}: {} samples, threshold={}, weights={}",
                iteration, dataset.getId(), samples.size(), threshold, weights);

        // score everything first so a provider failure leaves the dataset untouched
        List<ScoredSample> scored = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            scored.add(score(sample, weights));
        }

        List<ScoredSample> suspicious = new ArrayList<>();
        for (ScoredSample s : scored) {
            boolean flagged = priorityScorer.isSuspicious(s.confidence(), threshold);
            s.sample().setSuspicious(flagged);
            if (flagged) {
                suspicious.add(s);
            }
            log.debug("Sample {} confidence={} anomaly={} priority={} suspicious={}",
                    s.sample().getId(), s.confidence(), s.anomaly(), s.priority(), flagged);
        }

        int total = scored.size();
        double detectionRate = StatsUtils.percentage(suspicious.size(), total);

        DetectionRun run = DetectionRun.builder()
                .datasetId(datasetId)
                .iteration(iteration)
                .confidenceThreshold(threshold)
                .confidenceWeight(weights.confidenceWeight())
                .anomalyWeight(weights.anomalyWeight())
                .maxSamples(maxSamples)
                .totalSamplesAnalyzed(total)
                .suspiciousSamplesFound(suspicious.size())
                .detectionRate(detectionRate)
                .build();

        List<ScoredSample> ranked = priorityScorer.rank(suspicious);
        List<Detection> detections = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ScoredSample s = ranked.get(i);
            detections.add(Detection.builder()
                    .sample(s.sample())
                    .datasetId(datasetId)
                    .iteration(iteration)
                    .confidenceScore(s.confidence())
                    .anomalyScore(s.anomaly())
                    .priorityScore(s.priority())
                    .predictedLabel(s.predictedLabel())
                    .rank(i + 1)
                    .confidenceWeight(weights.confidenceWeight())
                    .anomalyWeight(weights.anomalyWeight())
                    .build());
        }

        try {
            detectionRunRepository.saveAndFlush(run);
            detectionRepository.saveAll(detections);
            sampleRepository.saveAll(samples);
            detectionRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Detection iteration " + iteration + " of dataset " + datasetId
                    + " was claimed by a concurrent run", e);
        }

        log.info("Detection iteration {} on dataset {} finished: {}/{} suspicious ({}%)",
                iteration, datasetId, suspicious.size(), total, detectionRate);

        return new DetectionRunResultDTO(
                datasetId,
                iteration,
                total,
                suspicious.size(),
                detectionRate,
                threshold,
                weights,
                LocalDateTime.now()
        );
    }

    public List<DetectionResponseDTO> listDetections(
            Long datasetId,
            Integer iteration,
            Double minPriority,
            Double minConfidence,
            Double minAnomaly,
            SignalType signalType,
            Integer limit,
            Integer offset
    ) {
        List<Detection> found = detectionRepository.search(datasetId, iteration, minPriority, minConfidence, minAnomaly);
        if (signalType != null) {
            found = found.stream()
                    .filter(d -> priorityScorer.classify(d.getConfidenceScore(), d.getAnomalyScore()).contains(signalType))
                    .toList();
        }
        int effectiveLimit = limit != null ? limit : detectionProperties.defaultListLimit();
        int effectiveOffset = offset != null ? offset : 0;
        return StatsUtils.page(found, effectiveLimit, effectiveOffset)
                .stream()
                .map(this::toResponseDTO)
                .toList();
    }

    public DetectionDetailsDTO getDetectionDetails(Long detectionId) {
        Detection detection = detectionRepository.findById(detectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Detection " + detectionId + " not found"));
        Sample sample = detection.getSample();

        return new DetectionDetailsDTO(
                toResponseDTO(detection),
                sample.getSampleIndex(),
                List.copyOf(sample.getFeatures()),
                sample.getOriginalLabel(),
                sample.getCurrentLabel(),
                sample.isSuspicious(),
                sample.isCorrected()
        );
    }

    public List<DetectionRunDTO> listRuns(Long datasetId) {
        requireDataset(datasetId);
        return detectionRunRepository.findByDatasetIdOrderByIterationDesc(datasetId)
                .stream()
                .map(DetectionMapper::toResponseDTO)
                .toList();
    }

    public DetectionStatsDTO getDetectionStats(Long datasetId) {
        requireDataset(datasetId);

        long totalSamples = sampleRepository.countByDatasetId(datasetId);
        long suspiciousSamples = sampleRepository.countByDatasetIdAndSuspiciousTrue(datasetId);
        long totalDetections = detectionRepository.countByDatasetId(datasetId);
        long highPriority = detectionRepository.countByDatasetIdAndPriorityScoreGreaterThanEqual(
                datasetId, detectionProperties.highPriorityThreshold());
        Double avgConfidence = detectionRepository.averageConfidence(datasetId);

        return new DetectionStatsDTO(
                datasetId,
                totalSamples,
                suspiciousSamples,
                totalDetections,
                highPriority,
                StatsUtils.round(avgConfidence != null ? avgConfidence : 0.0, 4),
                StatsUtils.percentage(suspiciousSamples, totalSamples)
        );
    }

    public SignalStatsDTO getSignalStats(Long datasetId, Integer iteration) {
        requireDataset(datasetId);

        List<Detection> detections = iteration == null
                ? detectionRepository.findByDatasetId(datasetId)
                : detectionRepository.findByDatasetIdAndIterationOrderByRankAsc(datasetId, iteration);

        long confidenceDominant = 0;
        long anomalyDominant = 0;
        long bothHigh = 0;
        double confidenceSum = 0.0;
        double anomalySum = 0.0;
        for (Detection d : detections) {
            Set<SignalType> types = priorityScorer.classify(d.getConfidenceScore(), d.getAnomalyScore());
            if (types.contains(SignalType.CONFIDENCE_DOMINANT)) confidenceDominant++;
            if (types.contains(SignalType.ANOMALY_DOMINANT)) anomalyDominant++;
            if (types.contains(SignalType.BOTH_HIGH)) bothHigh++;
            confidenceSum += d.getConfidenceScore();
            anomalySum += d.getAnomalyScore();
        }

        int total = detections.size();
        return new SignalStatsDTO(
                datasetId,
                iteration,
                total,
                confidenceDominant,
                anomalyDominant,
                bothHigh,
                total == 0 ? 0.0 : StatsUtils.round(confidenceSum / total, 4),
                total == 0 ? 0.0 : StatsUtils.round(anomalySum / total, 4)
        );
    }

    private ScoredSample score(Sample sample, PriorityWeights weights) {
        SignalPrediction prediction;
        double anomaly;
        try {
            prediction = signalProvider.predict(sample);
            anomaly = signalProvider.anomalyScore(sample);
        } catch (UpstreamSignalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamSignalException("Signal provider failed for sample " + sample.getId() + ": " + e.getMessage(), e);
        }
        if (prediction == null) {
            throw new UpstreamSignalException("Signal provider returned no prediction for sample " + sample.getId());
        }

        requireUnitInterval("confidence", prediction.confidence(), sample);
        requireUnitInterval("anomaly", anomaly, sample);

        double priority = priorityScorer.fuse(prediction.confidence(), anomaly, weights);
        return new ScoredSample(sample, prediction.predictedLabel(), prediction.confidence(), anomaly, priority);
    }

    private void requireUnitInterval(String signal, double value, Sample sample) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new UpstreamSignalException(
                    "Signal provider returned " + signal + " score " + value + " for sample " + sample.getId()
                            + ", expected a value in [0, 1]");
        }
    }

    private PriorityWeights defaultWeights() {
        return new PriorityWeights(
                detectionProperties.defaultConfidenceWeight(),
                detectionProperties.defaultAnomalyWeight()
        );
    }

    private void requireDataset(Long datasetId) {
        if (!datasetRepository.existsById(datasetId)) {
            throw new ResourceNotFoundException("Dataset " + datasetId + " not found");
        }
    }

    private DetectionResponseDTO toResponseDTO(Detection d) {
        return DetectionMapper.toResponseDTO(d, priorityScorer.classify(d.getConfidenceScore(), d.getAnomalyScore()));
    }
}
