package com.sldce.backend.dto.feedback;

import java.util.List;
import java.util.Map;

public record FeedbackPatternsDTO(
        Long datasetId,
        Integer iteration,
        int patternsFound,
        Map<String, AcceptanceBucketDTO> acceptanceByConfidence,
        Map<String, AcceptanceBucketDTO> acceptanceByPriority,
        List<String> insights
) {}
