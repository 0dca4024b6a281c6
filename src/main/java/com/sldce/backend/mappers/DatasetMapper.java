package com.sldce.backend.mappers;

import java.util.List;

import com.sldce.backend.dto.dataset.DatasetResponseDTO;
import com.sldce.backend.dto.dataset.SampleResponseDTO;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Sample;

public class DatasetMapper {
    private DatasetMapper() {}

    public static DatasetResponseDTO toResponseDTO(Dataset d) {
        if (d == null) return null;

        return new DatasetResponseDTO(
                d.getId(),
                d.getName(),
                d.getDescription(),
                d.getNumSamples(),
                d.getNumFeatures(),
                d.getNumClasses(),
                d.isActive(),
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }

    public static SampleResponseDTO toResponseDTO(Sample s) {
        if (s == null) return null;

        return new SampleResponseDTO(
                s.getId(),
                s.getDataset() != null ? s.getDataset().getId() : null,
                s.getSampleIndex(),
                s.getFeatures() != null ? List.copyOf(s.getFeatures()) : List.of(),
                s.getOriginalLabel(),
                s.getCurrentLabel(),
                s.isSuspicious(),
                s.isCorrected(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
