package com.sldce.backend.mappers;

import com.sldce.backend.dto.model.ModelRequestDTO;
import com.sldce.backend.dto.model.ModelResponseDTO;
import com.sldce.backend.entities.MlModel;

public class ModelMapper {
    private ModelMapper() {}

    public static MlModel toEntity(ModelRequestDTO dto) {
        if (dto == null) return null;

        MlModel m = new MlModel();
        m.setDatasetId(dto.datasetId());
        m.setName(dto.name().trim());
        m.setModelType(dto.modelType().trim());
        m.setDescription(dto.description());
        m.setIteration(dto.iteration());
        m.setBaseline(Boolean.TRUE.equals(dto.baseline()));
        m.setTrainAccuracy(dto.trainAccuracy());
        m.setTestAccuracy(dto.testAccuracy());
        m.setPrecision(dto.precision());
        m.setRecall(dto.recall());
        m.setF1Score(dto.f1Score());
        m.setNumSamplesTrained(dto.numSamplesTrained());
        m.setSamplesCorrected(dto.samplesCorrected());
        m.setTrainingTimeSeconds(dto.trainingTimeSeconds());
        m.setActive(true);
        return m;
    }

    public static ModelResponseDTO toResponseDTO(MlModel m) {
        if (m == null) return null;

        return new ModelResponseDTO(
                m.getId(),
                m.getDatasetId(),
                m.getName(),
                m.getModelType(),
                m.getDescription(),
                m.getIteration(),
                m.isBaseline(),
                m.getTrainAccuracy(),
                m.getTestAccuracy(),
                m.getPrecision(),
                m.getRecall(),
                m.getF1Score(),
                m.getNumSamplesTrained(),
                m.getSamplesCorrected(),
                m.getTrainingTimeSeconds(),
                m.isActive(),
                m.getCreatedAt()
        );
    }
}
