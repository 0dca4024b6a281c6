package com.sldce.backend.dto.feedback;

public record AcceptanceBucketDTO(
        long total,
        long accepted,
        double acceptanceRate
) {}
