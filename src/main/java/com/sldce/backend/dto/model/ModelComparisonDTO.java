package com.sldce.backend.dto.model;

import java.util.List;

/**
 * Improvement fields are null unless both a baseline and a later non-baseline model exist.
 */
public record ModelComparisonDTO(
        Long datasetId,
        List<ModelComparisonEntryDTO> models,
        Long baselineModelId,
        Long latestModelId,
        Double improvement,
        Double improvementPercent
) {}
