package com.sldce.backend.services;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.config.DetectionProperties;
import com.sldce.backend.dto.experiment.ExperimentIterationRequestDTO;
import com.sldce.backend.dto.experiment.ExperimentIterationResponseDTO;
import com.sldce.backend.dto.experiment.ExperimentRequestDTO;
import com.sldce.backend.dto.experiment.ExperimentResponseDTO;
import com.sldce.backend.dto.experiment.ExperimentSummaryDTO;
import com.sldce.backend.entities.Experiment;
import com.sldce.backend.entities.ExperimentIteration;
import com.sldce.backend.enums.ExperimentStatus;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.BusinessException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.ExperimentMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.ExperimentIterationRepository;
import com.sldce.backend.repositories.ExperimentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ExperimentService {

    static final int DEFAULT_MAX_ITERATIONS = 10;

    private final ExperimentRepository experimentRepository;
    private final ExperimentIterationRepository iterationRepository;
    private final DatasetRepository datasetRepository;
    private final DetectionProperties detectionProperties;

    @Auditable(action = "EXPERIMENT_CREATED", entityType = "Experiment")
    @Transactional
    public ExperimentResponseDTO create(ExperimentRequestDTO dto) {
        if (!datasetRepository.existsById(dto.datasetId())) {
            throw new ResourceNotFoundException("Dataset " + dto.datasetId() + " not found");
        }
        String name = dto.name().trim();
        if (experimentRepository.existsByDatasetIdAndName(dto.datasetId(), name)) {
            throw new ConflictException("Experiment '" + name + "' already exists for dataset " + dto.datasetId());
        }

        Experiment experiment = Experiment.builder()
                .datasetId(dto.datasetId())
                .name(name)
                .description(dto.description())
                .noisePercentage(dto.noisePercentage())
                .detectionThreshold(dto.detectionThreshold() != null
                        ? dto.detectionThreshold()
                        : detectionProperties.defaultConfidenceThreshold())
                .maxIterations(dto.maxIterations() != null ? dto.maxIterations() : DEFAULT_MAX_ITERATIONS)
                .build();

        Experiment saved = experimentRepository.save(experiment);
        log.info("Created experiment id={} name={} dataset={} maxIterations={}",
                saved.getId(), saved.getName(), saved.getDatasetId(), saved.getMaxIterations());
        return ExperimentMapper.toResponseDTO(saved);
    }

    public List<ExperimentResponseDTO> listExperiments(Long datasetId, Integer limit, Integer offset) {
        List<Experiment> experiments = datasetId == null
                ? experimentRepository.findAllByOrderByCreatedAtDescIdDesc()
                : experimentRepository.findByDatasetIdOrderByCreatedAtDescIdDesc(datasetId);
        return StatsUtils.page(experiments,
                        limit != null ? limit : detectionProperties.defaultListLimit(),
                        offset != null ? offset : 0).stream()
                .map(ExperimentMapper::toResponseDTO)
                .toList();
    }

    public ExperimentResponseDTO getExperiment(Long id) {
        return ExperimentMapper.toResponseDTO(findExperiment(id));
    }

    /**
     * Appends the next iteration's metrics. Iterations are numbered from 1 without gaps, and the first one
     * fixes the baseline accuracy.
     */
    @Auditable(action = "EXPERIMENT_ITERATION_RECORDED", entityType = "ExperimentIteration")
    @Transactional
    public ExperimentIterationResponseDTO recordIteration(Long experimentId, ExperimentIterationRequestDTO dto) {
        Experiment experiment = experimentRepository.findByIdForUpdate(experimentId)
                .orElseThrow(() -> new ResourceNotFoundException("Experiment " + experimentId + " not found"));
        if (experiment.getStatus() != ExperimentStatus.RUNNING) {
            throw new BusinessException("Experiment " + experimentId + " is "
                    + experiment.getStatus().getDisplayName().toLowerCase() + " and accepts no more iterations");
        }

        int number = dto.iterationNumber();
        if (number <= experiment.getCurrentIteration()) {
            throw new ConflictException("Iteration " + number + " already recorded for experiment " + experimentId);
        }
        if (number != experiment.getCurrentIteration() + 1) {
            throw new BadRequestException("Expected iteration " + (experiment.getCurrentIteration() + 1)
                    + ", got " + number);
        }
        if (number > experiment.getMaxIterations()) {
            throw new BadRequestException("Experiment " + experimentId + " allows at most "
                    + experiment.getMaxIterations() + " iterations");
        }

        ExperimentIteration saved = iterationRepository.save(ExperimentMapper.toIteration(experiment, dto));

        experiment.setCurrentIteration(number);
        experiment.setTotalCorrections(experiment.getTotalCorrections() + saved.getSamplesCorrected());
        if (number == 1 && experiment.getBaselineAccuracy() == null) {
            experiment.setBaselineAccuracy(saved.getAccuracy());
        }
        experiment.setFinalAccuracy(saved.getAccuracy());
        experimentRepository.save(experiment);

        log.info("Recorded iteration {} of experiment id={} accuracy={} corrected={}",
                number, experimentId, saved.getAccuracy(), saved.getSamplesCorrected());
        return ExperimentMapper.toResponseDTO(saved);
    }

    public List<ExperimentIterationResponseDTO> listIterations(Long experimentId) {
        findExperiment(experimentId);
        return iterationRepository.findByExperimentIdOrderByIterationNumberAsc(experimentId).stream()
                .map(ExperimentMapper::toResponseDTO)
                .toList();
    }

    public ExperimentSummaryDTO getSummary(Long experimentId) {
        Experiment experiment = findExperiment(experimentId);
        List<ExperimentIteration> iterations =
                iterationRepository.findByExperimentIdOrderByIterationNumberAsc(experimentId);

        if (iterations.isEmpty()) {
            return new ExperimentSummaryDTO(experiment.getId(), experiment.getName(),
                    experiment.getStatus().name(), 0, 0.0, 0.0, 0, 0.0);
        }

        double accuracyImprovement = 0.0;
        if (experiment.getBaselineAccuracy() != null && experiment.getFinalAccuracy() != null) {
            accuracyImprovement = StatsUtils.round(
                    (experiment.getFinalAccuracy() - experiment.getBaselineAccuracy()) * 100, 2);
        }

        ExperimentIteration last = iterations.get(iterations.size() - 1);
        double remainingNoise = last.getRemainingNoisePercentage() != null ? last.getRemainingNoisePercentage() : 0.0;
        double noiseReduction = StatsUtils.round(experiment.getNoisePercentage() - remainingNoise, 2);

        double avgTime = StatsUtils.round(iterations.stream()
                .mapToDouble(it -> it.getIterationTimeSeconds() != null ? it.getIterationTimeSeconds() : 0.0)
                .average()
                .orElse(0.0), 2);

        return new ExperimentSummaryDTO(
                experiment.getId(),
                experiment.getName(),
                experiment.getStatus().name(),
                iterations.size(),
                accuracyImprovement,
                noiseReduction,
                experiment.getTotalCorrections(),
                avgTime
        );
    }

    @Auditable(action = "EXPERIMENT_COMPLETED", entityType = "Experiment")
    @Transactional
    public ExperimentResponseDTO complete(Long experimentId, Double totalTimeSeconds) {
        if (totalTimeSeconds != null && (totalTimeSeconds.isNaN() || totalTimeSeconds < 0)) {
            throw new BadRequestException("totalTimeSeconds must not be negative, got " + totalTimeSeconds);
        }
        Experiment experiment = experimentRepository.findByIdForUpdate(experimentId)
                .orElseThrow(() -> new ResourceNotFoundException("Experiment " + experimentId + " not found"));
        if (experiment.getStatus() == ExperimentStatus.COMPLETED) {
            throw new ConflictException("Experiment " + experimentId + " is already completed");
        }

        experiment.setStatus(ExperimentStatus.COMPLETED);
        experiment.setCompletedAt(LocalDateTime.now());
        if (totalTimeSeconds != null) {
            experiment.setTotalTimeSeconds(totalTimeSeconds);
        }
        Experiment saved = experimentRepository.save(experiment);
        log.info("Completed experiment id={} after {} iterations", experimentId, saved.getCurrentIteration());
        return ExperimentMapper.toResponseDTO(saved);
    }

    private Experiment findExperiment(Long id) {
        return experimentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Experiment " + id + " not found"));
    }
}
