package com.sldce.backend.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.suggestion.SuggestionDetailsDTO;
import com.sldce.backend.dto.suggestion.SuggestionGenerateResultDTO;
import com.sldce.backend.dto.suggestion.SuggestionResponseDTO;
import com.sldce.backend.dto.suggestion.SuggestionStatsDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.DetectionRun;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.SuggestionStatus;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.SuggestionMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.DetectionRepository;
import com.sldce.backend.repositories.DetectionRunRepository;
import com.sldce.backend.repositories.SuggestionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SuggestionService {

    static final double VERY_CONFIDENT = 0.85;
    static final double STRONG_ANOMALY = 0.85;
    static final double BOTH_SIGNALS = 0.7;

    private final DatasetRepository datasetRepository;
    private final DetectionRunRepository detectionRunRepository;
    private final DetectionRepository detectionRepository;
    private final SuggestionRepository suggestionRepository;
    private final DetectionProperties detectionProperties;

    // detections that already have a suggestion are skipped, so a repeated call creates nothing
    @Auditable(action = "SUGGESTIONS_GENERATED", entityType = "Dataset")
    @Transactional
    public SuggestionGenerateResultDTO generateSuggestions(Long datasetId, Integer iteration, Integer topN) {
        if (topN != null && topN <= 0) {
            throw new BadRequestException("topN must be greater than zero, got " + topN);
        }
        if (!datasetRepository.existsById(datasetId)) {
            throw new ResourceNotFoundException("Dataset " + datasetId + " not found");
        }

        int targetIteration;
        if (iteration != null) {
            targetIteration = iteration;
        } else {
            Integer latest = detectionRunRepository.findMaxIteration(datasetId);
            if (latest == null) {
                throw new ResourceNotFoundException("Dataset " + datasetId + " has no detection runs");
            }
            targetIteration = latest;
        }

        // serializes concurrent generations for the same iteration
        DetectionRun run = detectionRunRepository.findByDatasetIdAndIterationForUpdate(datasetId, targetIteration)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Detection iteration " + targetIteration + " of dataset " + datasetId + " not found"));

        List<Detection> detections = detectionRepository.findByDatasetIdAndIterationOrderByRankAsc(datasetId, run.getIteration());
        if (topN != null && detections.size() > topN) {
            detections = detections.subList(0, topN);
        }

        List<Suggestion> created = new ArrayList<>();
        for (Detection detection : detections) {
            if (suggestionRepository.existsByDetectionId(detection.getId())) {
                continue;
            }
            created.add(Suggestion.builder()
                    .detection(detection)
                    .suggestedLabel(detection.getPredictedLabel())
                    .reason(buildReason(detection.getConfidenceScore(), detection.getAnomalyScore()))
                    .confidence(detection.getConfidenceScore())
                    .status(SuggestionStatus.PENDING)
                    .build());
        }

        try {
            suggestionRepository.saveAllAndFlush(created);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Suggestions for iteration " + targetIteration + " of dataset " + datasetId
                    + " were generated concurrently", e);
        }

        String message;
        if (detections.isEmpty()) {
            message = "No detections found for this iteration";
        } else if (created.isEmpty()) {
            message = "All detections already have suggestions";
        } else {
            message = "Generated " + created.size() + " suggestions";
        }
        log.info("Suggestions for dataset {} iteration {}: {} created from {} detections",
                datasetId, targetIteration, created.size(), detections.size());

        return new SuggestionGenerateResultDTO(datasetId, targetIteration, created.size(), detections.size(), message);
    }

    public List<SuggestionResponseDTO> listSuggestions(
            Long datasetId,
            Integer iteration,
            SuggestionStatus status,
            Double minConfidence,
            Integer limit,
            Integer offset
    ) {
        List<Suggestion> found = suggestionRepository.search(datasetId, iteration, status, minConfidence);
        return StatsUtils.page(
                        found,
                        limit != null ? limit : detectionProperties.defaultListLimit(),
                        offset != null ? offset : 0)
                .stream()
                .map(SuggestionMapper::toResponseDTO)
                .toList();
    }

    public SuggestionResponseDTO getSuggestion(Long id) {
        return SuggestionMapper.toResponseDTO(loadSuggestion(id));
    }

    public SuggestionDetailsDTO getSuggestionDetails(Long id) {
        Suggestion suggestion = loadSuggestion(id);
        Detection detection = suggestion.getDetection();
        Sample sample = detection.getSample();

        return new SuggestionDetailsDTO(
                SuggestionMapper.toResponseDTO(suggestion),
                detection.getIteration(),
                detection.getPredictedLabel(),
                sample.getCurrentLabel(),
                sample.getOriginalLabel(),
                detection.getConfidenceScore(),
                detection.getAnomalyScore(),
                detection.getPriorityScore(),
                List.copyOf(sample.getFeatures())
        );
    }

    public SuggestionStatsDTO getSuggestionStats(Long datasetId) {
        if (!datasetRepository.existsById(datasetId)) {
            throw new ResourceNotFoundException("Dataset " + datasetId + " not found");
        }

        long pending = suggestionRepository.countByDetectionDatasetIdAndStatus(datasetId, SuggestionStatus.PENDING);
        long accepted = suggestionRepository.countByDetectionDatasetIdAndStatus(datasetId, SuggestionStatus.ACCEPTED);
        long rejected = suggestionRepository.countByDetectionDatasetIdAndStatus(datasetId, SuggestionStatus.REJECTED);
        long modified = suggestionRepository.countByDetectionDatasetIdAndStatus(datasetId, SuggestionStatus.MODIFIED);
        long reviewed = accepted + rejected + modified;

        return new SuggestionStatsDTO(
                datasetId,
                pending + reviewed,
                pending,
                accepted,
                rejected,
                modified,
                reviewed,
                StatsUtils.acceptanceRate(accepted, modified, rejected)
        );
    }

    static String buildReason(double confidence, double anomaly) {
        StringBuilder reason = new StringBuilder();
        reason.append(String.format(Locale.ROOT,
                "High confidence (%.2f%%) disagreement with current label. Anomaly score: %.2f%%. ",
                confidence * 100, anomaly * 100));

        double gap = Math.abs(confidence - anomaly) * 100;
        if (confidence > anomaly) {
            reason.append(String.format(Locale.ROOT, "Classifier signal dominates by %.1f points. ", gap));
        } else if (anomaly > confidence) {
            reason.append(String.format(Locale.ROOT, "Anomaly signal dominates by %.1f points. ", gap));
        } else {
            reason.append("Both signals are equally strong. ");
        }

        if (confidence > VERY_CONFIDENT) {
            reason.append("Model is very confident about alternative label. ");
        }
        if (anomaly > STRONG_ANOMALY) {
            reason.append("Sample shows strong anomalous behavior for current class. ");
        }
        if (confidence >= BOTH_SIGNALS && anomaly >= BOTH_SIGNALS) {
            reason.append("Both signals agree - high likelihood of mislabeling.");
        }
        return reason.toString().trim();
    }

    private Suggestion loadSuggestion(Long id) {
        return suggestionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Suggestion " + id + " not found"));
    }
}
