package com.sldce.backend.mappers;

import com.sldce.backend.dto.experiment.ExperimentIterationRequestDTO;
import com.sldce.backend.dto.experiment.ExperimentIterationResponseDTO;
import com.sldce.backend.dto.experiment.ExperimentResponseDTO;
import com.sldce.backend.entities.Experiment;
import com.sldce.backend.entities.ExperimentIteration;

public class ExperimentMapper {
    private ExperimentMapper() {}

    public static ExperimentIteration toIteration(Experiment experiment, ExperimentIterationRequestDTO dto) {
        if (dto == null) return null;

        return ExperimentIteration.builder()
                .experiment(experiment)
                .iterationNumber(dto.iterationNumber())
                .accuracy(dto.accuracy())
                .precision(dto.precision())
                .recall(dto.recall())
                .f1Score(dto.f1Score())
                .samplesFlagged(zeroIfNull(dto.samplesFlagged()))
                .samplesReviewed(zeroIfNull(dto.samplesReviewed()))
                .samplesCorrected(zeroIfNull(dto.samplesCorrected()))
                .correctionAcceptanceRate(dto.correctionAcceptanceRate())
                .remainingNoisePercentage(dto.remainingNoisePercentage())
                .iterationTimeSeconds(dto.iterationTimeSeconds())
                .build();
    }

    public static ExperimentResponseDTO toResponseDTO(Experiment e) {
        if (e == null) return null;

        return new ExperimentResponseDTO(
                e.getId(),
                e.getDatasetId(),
                e.getName(),
                e.getDescription(),
                e.getStatus().name(),
                e.getNoisePercentage(),
                e.getDetectionThreshold(),
                e.getMaxIterations(),
                e.getCurrentIteration(),
                e.getBaselineAccuracy(),
                e.getFinalAccuracy(),
                e.getTotalCorrections(),
                e.getTotalTimeSeconds(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.getCompletedAt()
        );
    }

    public static ExperimentIterationResponseDTO toResponseDTO(ExperimentIteration it) {
        if (it == null) return null;

        return new ExperimentIterationResponseDTO(
                it.getId(),
                it.getExperiment().getId(),
                it.getIterationNumber(),
                it.getAccuracy(),
                it.getPrecision(),
                it.getRecall(),
                it.getF1Score(),
                it.getSamplesFlagged(),
                it.getSamplesReviewed(),
                it.getSamplesCorrected(),
                it.getCorrectionAcceptanceRate(),
                it.getRemainingNoisePercentage(),
                it.getIterationTimeSeconds(),
                it.getCreatedAt()
        );
    }

    private static int zeroIfNull(Integer value) {
        return value == null ? 0 : value;
    }
}
