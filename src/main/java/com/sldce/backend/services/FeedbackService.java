package com.sldce.backend.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.feedback.AcceptanceBucketDTO;
import com.sldce.backend.dto.feedback.FeedbackDetailsDTO;
import com.sldce.backend.dto.feedback.FeedbackPatternsDTO;
import com.sldce.backend.dto.feedback.FeedbackResponseDTO;
import com.sldce.backend.dto.feedback.FeedbackStatsDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.Feedback;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.DetectionMapper;
import com.sldce.backend.mappers.FeedbackMapper;
import com.sldce.backend.mappers.SuggestionMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.FeedbackRepository;
import com.sldce.backend.services.detection.PriorityScorer;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FeedbackService {

    static final double HIGH_PRIORITY_BAND = 0.7;
    static final double MEDIUM_PRIORITY_BAND = 0.4;

    private final FeedbackRepository feedbackRepository;
    private final DatasetRepository datasetRepository;
    private final PriorityScorer priorityScorer;
    private final DetectionProperties detectionProperties;

    public List<FeedbackResponseDTO> listFeedback(
            Long datasetId,
            Integer iteration,
            FeedbackAction action,
            Integer limit,
            Integer offset
    ) {
        List<Feedback> found = feedbackRepository.search(datasetId, iteration, action);
        return StatsUtils.page(
                        found,
                        limit != null ? limit : detectionProperties.defaultListLimit(),
                        offset != null ? offset : 0)
                .stream()
                .map(FeedbackMapper::toResponseDTO)
                .toList();
    }

    public FeedbackResponseDTO getFeedback(Long id) {
        return FeedbackMapper.toResponseDTO(loadFeedback(id));
    }

    public FeedbackDetailsDTO getFeedbackDetails(Long id) {
        Feedback feedback = loadFeedback(id);
        Suggestion suggestion = feedback.getSuggestion();
        Detection detection = suggestion.getDetection();
        Sample sample = feedback.getSample();

        return new FeedbackDetailsDTO(
                FeedbackMapper.toResponseDTO(feedback),
                SuggestionMapper.toResponseDTO(suggestion),
                DetectionMapper.toResponseDTO(detection,
                        priorityScorer.classify(detection.getConfidenceScore(), detection.getAnomalyScore())),
                sample.getOriginalLabel(),
                sample.getCurrentLabel()
        );
    }

    public FeedbackStatsDTO getFeedbackStats(Long datasetId) {
        requireDataset(datasetId);

        long accepted = feedbackRepository.countByDatasetIdAndAction(datasetId, FeedbackAction.ACCEPT);
        long rejected = feedbackRepository.countByDatasetIdAndAction(datasetId, FeedbackAction.REJECT);
        long modified = feedbackRepository.countByDatasetIdAndAction(datasetId, FeedbackAction.MODIFY);

        return new FeedbackStatsDTO(
                datasetId,
                accepted + rejected + modified,
                accepted,
                rejected,
                modified,
                StatsUtils.acceptanceRate(accepted, modified, rejected)
        );
    }

    /**
     * Acceptance rates by confidence decile and by priority band, over all iterations or a single one.
     */
    public FeedbackPatternsDTO getFeedbackPatterns(Long datasetId, Integer iteration) {
        requireDataset(datasetId);

        List<Feedback> feedback = feedbackRepository.findWithDetectionByDatasetId(datasetId, iteration);
        if (feedback.isEmpty()) {
            return new FeedbackPatternsDTO(datasetId, iteration, 0, Map.of(), Map.of(),
                    List.of("No feedback available for pattern analysis"));
        }

        Map<Integer, long[]> byDecile = new TreeMap<>();
        Map<String, long[]> byBand = new LinkedHashMap<>();
        byBand.put("high", new long[2]);
        byBand.put("medium", new long[2]);
        byBand.put("low", new long[2]);

        for (Feedback f : feedback) {
            Detection detection = f.getSuggestion().getDetection();
            boolean kept = f.getAction().isCorrection();

            long[] decile = byDecile.computeIfAbsent(confidenceDecile(detection.getConfidenceScore()), k -> new long[2]);
            decile[0]++;
            if (kept) decile[1]++;

            long[] band = byBand.get(priorityBand(detection.getPriorityScore()));
            band[0]++;
            if (kept) band[1]++;
        }

        Map<String, AcceptanceBucketDTO> acceptanceByConfidence = new LinkedHashMap<>();
        byDecile.forEach((decile, counts) -> acceptanceByConfidence.put(decile + "%", toBucket(counts)));

        Map<String, AcceptanceBucketDTO> acceptanceByPriority = new LinkedHashMap<>();
        byBand.forEach((band, counts) -> {
            if (counts[0] > 0) {
                acceptanceByPriority.put(band, toBucket(counts));
            }
        });

        return new FeedbackPatternsDTO(
                datasetId,
                iteration,
                feedback.size(),
                acceptanceByConfidence,
                acceptanceByPriority,
                buildInsights(acceptanceByConfidence, acceptanceByPriority)
        );
    }

    static int confidenceDecile(double confidence) {
        return (int) (confidence * 10) * 10;
    }

    static String priorityBand(double priority) {
        if (priority >= HIGH_PRIORITY_BAND) return "high";
        if (priority >= MEDIUM_PRIORITY_BAND) return "medium";
        return "low";
    }

    private List<String> buildInsights(
            Map<String, AcceptanceBucketDTO> byConfidence,
            Map<String, AcceptanceBucketDTO> byPriority
    ) {
        List<String> insights = new ArrayList<>();

        String bestRange = null;
        AcceptanceBucketDTO best = null;
        for (Map.Entry<String, AcceptanceBucketDTO> entry : byConfidence.entrySet()) {
            if (best == null || entry.getValue().acceptanceRate() > best.acceptanceRate()) {
                bestRange = entry.getKey();
                best = entry.getValue();
            }
        }
        if (best != null) {
            insights.add(String.format(Locale.ROOT, "Highest acceptance rate (%.0f%%) at %s confidence",
                    best.acceptanceRate(), bestRange));
        }

        AcceptanceBucketDTO high = byPriority.get("high");
        if (high != null) {
            insights.add(String.format(Locale.ROOT, "High priority detections accepted %.0f%% of the time",
                    high.acceptanceRate()));
        }
        return insights;
    }

    private AcceptanceBucketDTO toBucket(long[] counts) {
        return new AcceptanceBucketDTO(counts[0], counts[1], StatsUtils.percentage(counts[1], counts[0]));
    }

    private Feedback loadFeedback(Long id) {
        return feedbackRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Feedback " + id + " not found"));
    }

    private void requireDataset(Long datasetId) {
        if (!datasetRepository.existsById(datasetId)) {
            throw new ResourceNotFoundException("Dataset " + datasetId + " not found");
        }
    }
}
