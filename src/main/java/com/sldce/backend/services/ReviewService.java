package com.sldce.backend.services;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.dto.suggestion.SuggestionResponseDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.Feedback;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.enums.SuggestionStatus;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.InvalidTransitionException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.SuggestionMapper;
import com.sldce.backend.repositories.FeedbackRepository;
import com.sldce.backend.repositories.SampleRepository;
import com.sldce.backend.repositories.SuggestionRepository;
import com.sldce.backend.services.review.ReviewDecision;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a suggestion out of {@link SuggestionStatus#PENDING} and records the decision as feedback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private final SuggestionRepository suggestionRepository;
    private final FeedbackRepository feedbackRepository;
    private final SampleRepository sampleRepository;

    @Auditable(action = "SUGGESTION_REVIEWED", entityType = "Suggestion")
    @Transactional
    public SuggestionResponseDTO review(
            Long suggestionId,
            ReviewDecision decision,
            String reviewerNotes,
            Double reviewTimeSeconds
    ) {
        if (decision == null) {
            throw new BadRequestException("Review decision is required");
        }
        if (reviewTimeSeconds != null && reviewTimeSeconds < 0) {
            throw new BadRequestException("reviewTimeSeconds must not be negative, got " + reviewTimeSeconds);
        }

        Suggestion suggestion = suggestionRepository.findByIdForUpdate(suggestionId)
                .orElseThrow(() -> new ResourceNotFoundException("Suggestion " + suggestionId + " not found"));

        if (suggestion.getStatus().isTerminal()) {
            throw new InvalidTransitionException(suggestionId, suggestion.getStatus());
        }

        Detection detection = suggestion.getDetection();
        Sample sample = detection.getSample();
        FeedbackAction action = decision.action();

        if (action == FeedbackAction.MODIFY) {
            List<Integer> knownLabels = sampleRepository.findDistinctOriginalLabels(detection.getDatasetId());
            if (!knownLabels.contains(decision.customLabel())) {
                throw new BadRequestException("Label " + decision.customLabel() + " is not a known label of dataset "
                        + detection.getDatasetId() + " " + knownLabels);
            }
        }

        int finalLabel = decision.finalLabel(suggestion, sample);

        suggestion.setStatus(action.getResultingStatus());
        suggestion.setReviewedAt(LocalDateTime.now());
        suggestion.setReviewerNotes(reviewerNotes);
        suggestion.setCustomLabel(action == FeedbackAction.MODIFY ? decision.customLabel() : null);

        Feedback feedback = Feedback.builder()
                .suggestion(suggestion)
                .sample(sample)
                .datasetId(detection.getDatasetId())
                .action(action)
                .finalLabel(finalLabel)
                .iteration(detection.getIteration())
                .reviewTimeSeconds(reviewTimeSeconds)
                .build();

        try {
            suggestionRepository.save(suggestion);
            feedbackRepository.saveAndFlush(feedback);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Feedback for suggestion " + suggestionId + " was recorded concurrently", e);
        }

        log.info("Suggestion {} reviewed: {} -> label {} (sample {}, iteration {})",
                suggestionId, action, finalLabel, sample.getId(), detection.getIteration());
        return SuggestionMapper.toResponseDTO(suggestion);
    }
}
