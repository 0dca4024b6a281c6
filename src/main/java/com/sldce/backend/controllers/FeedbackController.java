package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.feedback.*;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.services.FeedbackService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;

    @GetMapping("/list")
    public ResponseEntity<ApiResponse<List<FeedbackResponseDTO>>> list(
            @RequestParam(required = false) Long datasetId,
            @RequestParam(required = false) Integer iteration,
            @RequestParam(required = false) FeedbackAction action,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        List<FeedbackResponseDTO> list = feedbackService.listFeedback(datasetId, iteration, action, limit, offset);
        return ResponseEntity.ok(ApiResponse.success(list, "Feedback found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<FeedbackResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(feedbackService.getFeedback(id), "Feedback found"));
    }

    @GetMapping("/{id}/details")
    public ResponseEntity<ApiResponse<FeedbackDetailsDTO>> details(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(feedbackService.getFeedbackDetails(id), "Feedback found"));
    }

    @GetMapping("/stats/{datasetId}")
    public ResponseEntity<ApiResponse<FeedbackStatsDTO>> stats(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(feedbackService.getFeedbackStats(datasetId), "Feedback statistics"));
    }

    @GetMapping("/patterns/{datasetId}")
    public ResponseEntity<ApiResponse<FeedbackPatternsDTO>> patterns(
            @PathVariable Long datasetId,
            @RequestParam(required = false) Integer iteration
    ) {
        FeedbackPatternsDTO patterns = feedbackService.getFeedbackPatterns(datasetId, iteration);
        return ResponseEntity.ok(ApiResponse.success(patterns, "Feedback patterns"));
    }
}
