package com.sldce.backend.services;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sldce.backend.audit.Auditable;
import com.sldce.backend.dto.dataset.DatasetRequestDTO;
import com.sldce.backend.dto.dataset.DatasetResponseDTO;
import com.sldce.backend.dto.dataset.SampleInputDTO;
import com.sldce.backend.dto.dataset.SampleResponseDTO;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.mappers.DatasetMapper;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.SampleRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DatasetService {

    private final DatasetRepository datasetRepository;
    private final SampleRepository sampleRepository;

    @Auditable(action = "DATASET_REGISTERED", entityType = "Dataset")
    @Transactional
    public DatasetResponseDTO register(DatasetRequestDTO dto) {
        if (dto.name() == null || dto.name().isBlank()) {
            throw new BadRequestException("Dataset name is required");
        }
        if (dto.samples() == null || dto.samples().isEmpty()) {
            throw new BadRequestException("Dataset must contain at least one sample");
        }
        String name = dto.name().trim();
        if (datasetRepository.existsByName(name)) {
            throw new ConflictException("Dataset with name '" + name + "' already exists");
        }

        List<SampleInputDTO> inputs = dto.samples();
        for (int i = 0; i < inputs.size(); i++) {
            SampleInputDTO input = inputs.get(i);
            if (input == null || input.features() == null || input.features().isEmpty() || input.label() == null) {
                throw new BadRequestException("Sample " + i + " needs non-empty features and a label");
            }
        }

        int numFeatures = inputs.get(0).features().size();
        Set<Integer> labels = new LinkedHashSet<>();
        for (int i = 0; i < inputs.size(); i++) {
            SampleInputDTO input = inputs.get(i);
            if (input.features().size() != numFeatures) {
                throw new BadRequestException("Sample " + i + " has " + input.features().size()
                        + " features, expected " + numFeatures);
            }
            labels.add(input.label());
        }

        Dataset dataset = Dataset.builder()
                .name(name)
                .description(dto.description())
                .numSamples(inputs.size())
                .numFeatures(numFeatures)
                .numClasses(labels.size())
                .active(true)
                .build();
        Dataset saved = datasetRepository.save(dataset);

        List<Sample> samples = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            SampleInputDTO input = inputs.get(i);
            samples.add(Sample.builder()
                    .dataset(saved)
                    .sampleIndex(i)
                    .features(new ArrayList<>(input.features()))
                    .originalLabel(input.label())
                    .currentLabel(input.label())
                    .build());
        }
        sampleRepository.saveAll(samples);

        log.info("Registered dataset id={} name={} samples={} features={} classes={}",
                saved.getId(), name, samples.size(), numFeatures, labels.size());
        return DatasetMapper.toResponseDTO(saved);
    }

    public List<DatasetResponseDTO> findAll() {
        return datasetRepository.findByActiveTrueOrderByCreatedAtDesc()
                .stream()
                .map(DatasetMapper::toResponseDTO)
                .toList();
    }

    public DatasetResponseDTO findById(Long id) {
        return DatasetMapper.toResponseDTO(loadDataset(id));
    }

    public List<SampleResponseDTO> listSamples(Long datasetId, int limit, int offset) {
        loadDataset(datasetId);
        List<Sample> samples = sampleRepository.findByDatasetIdOrderBySampleIndexAscIdAsc(datasetId);
        return StatsUtils.page(samples, limit, offset)
                .stream()
                .map(DatasetMapper::toResponseDTO)
                .toList();
    }

    public SampleResponseDTO getSample(Long sampleId) {
        Sample sample = sampleRepository.findById(sampleId)
                .orElseThrow(() -> new ResourceNotFoundException("Sample " + sampleId + " not found"));
        return DatasetMapper.toResponseDTO(sample);
    }

    /**
     * Labels a reviewer may assign: the distinct original labels of the dataset.
     */
    public List<Integer> knownLabels(Long datasetId) {
        loadDataset(datasetId);
        return sampleRepository.findDistinctOriginalLabels(datasetId);
    }

    private Dataset loadDataset(Long id) {
        return datasetRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Dataset " + id + " not found"));
    }
}
