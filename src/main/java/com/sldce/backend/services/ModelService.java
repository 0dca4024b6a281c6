package com.sldce.backend.services;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.dto.model.ModelComparisonDTO;
import com.sldce.backend.dto.model.ModelComparisonEntryDTO;
import com.sldce.backend.dto.model.ModelRequestDTO;
import com.sldce.backend.dto.model.ModelResponseDTO;
import com.sldce.backend.entities.MlModel;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.ModelMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.MlModelRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ModelService {

    private final MlModelRepository mlModelRepository;
    private final DatasetRepository datasetRepository;

    @Auditable(action = "MODEL_REGISTERED", entityType = "MlModel")
    @Transactional
    public ModelResponseDTO register(ModelRequestDTO dto) {
        if (!datasetRepository.existsById(dto.datasetId())) {
            throw new ResourceNotFoundException("Dataset " + dto.datasetId() + " not found");
        }
        String name = dto.name().trim();
        if (mlModelRepository.existsByDatasetIdAndName(dto.datasetId(), name)) {
            throw new ConflictException("Model '" + name + "' already registered for dataset " + dto.datasetId());
        }

        MlModel saved = mlModelRepository.save(ModelMapper.toEntity(dto));
        log.info("Registered model id={} name={} dataset={} iteration={} baseline={}",
                saved.getId(), saved.getName(), saved.getDatasetId(), saved.getIteration(), saved.isBaseline());
        return ModelMapper.toResponseDTO(saved);
    }

    public List<ModelResponseDTO> listModels(Long datasetId) {
        List<MlModel> models = datasetId == null
                ? mlModelRepository.findByActiveTrueOrderByCreatedAtDesc()
                : mlModelRepository.findByDatasetIdAndActiveTrueOrderByCreatedAtDesc(datasetId);
        return models.stream()
                .map(ModelMapper::toResponseDTO)
                .toList();
    }

    public ModelResponseDTO getModel(Long id) {
        MlModel model = mlModelRepository.findByIdAndActiveTrue(id)
                .orElseThrow(() -> new ResourceNotFoundException("Model " + id + " not found"));
        return ModelMapper.toResponseDTO(model);
    }

    // improvement runs from the first baseline model to the latest non-baseline one
    public ModelComparisonDTO compareModels(Long datasetId) {
        List<MlModel> models = mlModelRepository.findByDatasetIdAndActiveTrueOrderByIterationAscCreatedAtAscIdAsc(datasetId);
        if (models.isEmpty()) {
            throw new ResourceNotFoundException("No models found for dataset " + datasetId);
        }

        List<ModelComparisonEntryDTO> entries = models.stream()
                .map(m -> new ModelComparisonEntryDTO(
                        m.getId(),
                        m.getName(),
                        m.getModelType(),
                        m.getIteration(),
                        m.isBaseline(),
                        StatsUtils.round(m.effectiveAccuracy(), 4),
                        m.getF1Score(),
                        m.getSamplesCorrected(),
                        m.getCreatedAt()))
                .toList();

        MlModel baseline = models.stream().filter(MlModel::isBaseline).findFirst().orElse(null);
        MlModel latest = null;
        for (MlModel m : models) {
            if (!m.isBaseline()) {
                latest = m;
            }
        }

        Double improvement = null;
        Double improvementPercent = null;
        if (baseline != null && latest != null) {
            double delta = latest.effectiveAccuracy() - baseline.effectiveAccuracy();
            improvement = StatsUtils.round(delta, 4);
            if (baseline.effectiveAccuracy() > 0) {
                improvementPercent = StatsUtils.round(delta / baseline.effectiveAccuracy() * 100, 2);
            }
        }

        return new ModelComparisonDTO(
                datasetId,
                entries,
                baseline != null ? baseline.getId() : null,
                latest != null ? latest.getId() : null,
                improvement,
                improvementPercent
        );
    }
}
