package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.suggestion.*;
import com.sldce.backend.enums.SuggestionStatus;
import com.sldce.backend.services.ReviewService;
import com.sldce.backend.services.SuggestionService;
import com.sldce.backend.services.review.ReviewDecision;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/suggestions")
@RequiredArgsConstructor
public class SuggestionController {

    private final SuggestionService suggestionService;
    private final ReviewService reviewService;

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<SuggestionGenerateResultDTO>> generate(
            @Valid @RequestBody SuggestionGenerateRequestDTO dto
    ) {
        SuggestionGenerateResultDTO result = suggestionService.generateSuggestions(dto.datasetId(), dto.iteration(), dto.topN());
        return ResponseEntity.ok(ApiResponse.success(result, result.message()));
    }

    @GetMapping("/list")
    public ResponseEntity<ApiResponse<List<SuggestionResponseDTO>>> list(
            @RequestParam(required = false) Long datasetId,
            @RequestParam(required = false) Integer iteration,
            @RequestParam(required = false) SuggestionStatus status,
            @RequestParam(required = false) Double minConfidence,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        List<SuggestionResponseDTO> list = suggestionService.listSuggestions(
                datasetId, iteration, status, minConfidence, limit, offset);
        return ResponseEntity.ok(ApiResponse.success(list, "Suggestions found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SuggestionResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(suggestionService.getSuggestion(id), "Suggestion found"));
    }

    @GetMapping("/{id}/details")
    public ResponseEntity<ApiResponse<SuggestionDetailsDTO>> details(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(suggestionService.getSuggestionDetails(id), "Suggestion found"));
    }

    @PostMapping("/{id}/review")
    public ResponseEntity<ApiResponse<SuggestionResponseDTO>> review(
            @PathVariable Long id,
            @Valid @RequestBody ReviewRequestDTO dto
    ) {
        ReviewDecision decision = ReviewDecision.of(dto.action(), dto.customLabel());
        SuggestionResponseDTO reviewed = reviewService.review(id, decision, dto.reviewerNotes(), dto.reviewTimeSeconds());
        return ResponseEntity.ok(ApiResponse.success(reviewed, "Suggestion " + reviewed.status().getDisplayName().toLowerCase()));
    }

    @GetMapping("/stats/{datasetId}")
    public ResponseEntity<ApiResponse<SuggestionStatsDTO>> stats(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(suggestionService.getSuggestionStats(datasetId), "Suggestion statistics"));
    }
}
