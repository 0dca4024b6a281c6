package com.sldce.backend.mappers;

import java.util.Set;

import com.sldce.backend.dto.detection.DetectionRunDTO;
import com.sldce.backend.dto.detection.DetectionResponseDTO;
import com.sldce.backend.entities.Detection;
import com.sldce.backend.entities.DetectionRun;
import com.sldce.backend.enums.SignalType;

public class DetectionMapper {
    private DetectionMapper() {}

    public static DetectionResponseDTO toResponseDTO(Detection d, Set<SignalType> signalTypes) {
        if (d == null) return null;

        return new DetectionResponseDTO(
                d.getId(),
                d.getSample() != null ? d.getSample().getId() : null,
                d.getDatasetId(),
                d.getIteration(),
                d.getConfidenceScore(),
                d.getAnomalyScore(),
                d.getPriorityScore(),
                d.getPredictedLabel(),
                d.getRank(),
                d.getConfidenceWeight(),
                d.getAnomalyWeight(),
                signalTypes != null ? Set.copyOf(signalTypes) : Set.of(),
                d.getDetectedAt()
        );
    }

    public static DetectionRunDTO toResponseDTO(DetectionRun r) {
        if (r == null) return null;

        return new DetectionRunDTO(
                r.getId(),
                r.getDatasetId(),
                r.getIteration(),
                r.getConfidenceThreshold(),
                r.getConfidenceWeight(),
                r.getAnomalyWeight(),
                r.getMaxSamples(),
                r.getTotalSamplesAnalyzed(),
                r.getSuspiciousSamplesFound(),
                r.getDetectionRate(),
                r.getCreatedAt()
        );
    }
}
