package com.sldce.backend.services;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.dto.correction.CorrectionApplyResultDTO;
import com.sldce.backend.dto.correction.CorrectionChangeDTO;
import com.sldce.backend.dto.correction.CorrectionPreviewDTO;
import com.sldce.backend.dto.correction.CorrectionSummaryDTO;
import com.sldce.backend.entities.Feedback;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.FeedbackRepository;
import com.sldce.backend.repositories.SampleRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CorrectionService {

    private final DatasetRepository datasetRepository;
    private final SampleRepository sampleRepository;
    private final FeedbackRepository feedbackRepository;

    public CorrectionPreviewDTO previewCorrections(Long datasetId, int iteration) {
        requireDataset(datasetId);
        requireIteration(iteration);

        List<Feedback> feedback = feedbackRepository.findWithSampleByDatasetIdAndIteration(datasetId, iteration);
        List<CorrectionChangeDTO> changes = new ArrayList<>();
        int rejects = 0;
        for (Feedback f : feedback) {
            if (!f.getAction().isCorrection()) {
                rejects++;
                continue;
            }
            Sample sample = f.getSample();
            if (sample.getCurrentLabel() != f.getFinalLabel()) {
                changes.add(new CorrectionChangeDTO(sample.getId(), sample.getCurrentLabel(), f.getFinalLabel(), f.getAction()));
            }
        }
        changes.sort(Comparator.comparing(CorrectionChangeDTO::sampleId));

        long datasetSamples = sampleRepository.countByDatasetId(datasetId);
        return new CorrectionPreviewDTO(
                datasetId,
                iteration,
                changes.size(),
                feedback.size(),
                rejects,
                StatsUtils.percentage(changes.size(), datasetSamples),
                changes
        );
    }

    @Auditable(action = "CORRECTIONS_APPLIED", entityType = "Dataset")
    @Transactional
    public CorrectionApplyResultDTO applyCorrections(Long datasetId, int iteration) {
        requireDataset(datasetId);
        requireIteration(iteration);

        List<Feedback> feedback = feedbackRepository.findByDatasetIdAndIterationOrderByIdAsc(datasetId, iteration);
        List<Feedback> corrections = feedback.stream()
                .filter(f -> f.getAction().isCorrection())
                .toList();
        int rejects = feedback.size() - corrections.size();

        // samples are read under lock so a concurrent apply sees our writes before comparing
        List<Long> sampleIds = corrections.stream()
                .map(f -> f.getSample().getId())
                .distinct()
                .toList();
        Map<Long, Sample> locked = sampleIds.isEmpty()
                ? Map.of()
                : sampleRepository.findAllByIdForUpdate(sampleIds).stream()
                        .collect(Collectors.toMap(Sample::getId, Function.identity()));

        int labelsChanged = 0;
        int inEffect = 0;
        for (Feedback f : corrections) {
            Sample sample = locked.get(f.getSample().getId());
            if (sample == null) {
                continue;
            }
            if (sample.getCurrentLabel() != f.getFinalLabel()) {
                log.debug("Sample {} label {} -> {} ({})", sample.getId(), sample.getCurrentLabel(), f.getFinalLabel(), f.getAction());
                sample.setCurrentLabel(f.getFinalLabel());
                sample.setCorrected(true);
                labelsChanged++;
            }
            inEffect++;
        }
        if (labelsChanged > 0) {
            sampleRepository.saveAll(locked.values());
        }

        log.info("Corrections for dataset {} iteration {}: {} labels changed, {} corrections in effect, {} rejected",
                datasetId, iteration, labelsChanged, inEffect, rejects);

        return new CorrectionApplyResultDTO(
                datasetId,
                iteration,
                inEffect,
                labelsChanged,
                rejects,
                feedback.size(),
                LocalDateTime.now()
        );
    }

    public CorrectionSummaryDTO getCorrectionSummary(Long datasetId) {
        requireDataset(datasetId);

        List<Sample> samples = sampleRepository.findByDatasetIdOrderBySampleIndexAscIdAsc(datasetId);
        long total = samples.size();
        long corrected = samples.stream().filter(Sample::isCorrected).count();
        long changed = samples.stream().filter(s -> s.getOriginalLabel() != s.getCurrentLabel()).count();
        long suspicious = samples.stream().filter(Sample::isSuspicious).count();

        Map<Integer, Long> originalDistribution = samples.stream()
                .collect(Collectors.groupingBy(Sample::getOriginalLabel, TreeMap::new, Collectors.counting()));
        Map<Integer, Long> currentDistribution = samples.stream()
                .collect(Collectors.groupingBy(Sample::getCurrentLabel, TreeMap::new, Collectors.counting()));

        return new CorrectionSummaryDTO(
                datasetId,
                total,
                corrected,
                changed,
                suspicious,
                StatsUtils.percentage(corrected, total),
                StatsUtils.percentage(changed, total),
                originalDistribution,
                currentDistribution
        );
    }

    private void requireDataset(Long datasetId) {
        if (!datasetRepository.existsById(datasetId)) {
            throw new ResourceNotFoundException("Dataset " + datasetId + " not found");
        }
    }

    private void requireIteration(int iteration) {
        if (iteration <= 0) {
            throw new BadRequestException("iteration must be greater than zero, got " + iteration);
        }
    }
}
