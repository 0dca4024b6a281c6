package com.sldce.backend.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sldce.backend.dto.dataset.DatasetRequestDTO;
import com.sldce.backend.dto.dataset.DatasetResponseDTO;
import com.sldce.backend.dto.dataset.SampleInputDTO;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.repositories.DatasetRepository;
import com.sldce.backend.repositories.SampleRepository;

@ExtendWith(MockitoExtension.class)
class DatasetServiceTest {

    @Mock
    DatasetRepository datasetRepository;

    @Mock
    SampleRepository sampleRepository;

    @InjectMocks
    DatasetService datasetService;

    @Captor
    ArgumentCaptor<Iterable<Sample>> samplesCaptor;

    @Test
    void register_countsClassesAndIndexesSamples() {
        when(datasetRepository.existsByName("iris")).thenReturn(false);
        when(datasetRepository.save(any(Dataset.class))).thenAnswer(inv -> {
            Dataset d = inv.getArgument(0);
            d.setId(1L);
            return d;
        });

        DatasetResponseDTO result = datasetService.register(new DatasetRequestDTO(" iris ", null, List.of(
                new SampleInputDTO(List.of(0.1, 0.2), 0),
                new SampleInputDTO(List.of(0.3, 0.4), 2),
                new SampleInputDTO(List.of(0.5, 0.6), 0)
        )));

        assertThat(result.name()).isEqualTo("iris");
        assertThat(result.numSamples()).isEqualTo(3);
        assertThat(result.numFeatures()).isEqualTo(2);
        assertThat(result.numClasses()).isEqualTo(2);

        verify(sampleRepository).saveAll(samplesCaptor.capture());
        List<Sample> saved = new ArrayList<>();
        samplesCaptor.getValue().forEach(saved::add);
        assertThat(saved).extracting(Sample::getSampleIndex).containsExactly(0, 1, 2);
        assertThat(saved).allSatisfy(s -> assertThat(s.getCurrentLabel()).isEqualTo(s.getOriginalLabel()));
    }

    @Test
    void register_emptySamples_isValidationError() {
        assertThatThrownBy(() -> datasetService.register(new DatasetRequestDTO("empty", null, List.of())))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("at least one sample");

        verifyNoInteractions(datasetRepository, sampleRepository);
    }

    @Test
    void register_nullSamples_isValidationError() {
        assertThatThrownBy(() -> datasetService.register(new DatasetRequestDTO("none", null, null)))
                .isInstanceOf(BadRequestException.class);

        verifyNoInteractions(datasetRepository, sampleRepository);
    }

    @Test
    void register_sampleWithoutFeatures_isValidationError() {
        when(datasetRepository.existsByName("holes")).thenReturn(false);

        assertThatThrownBy(() -> datasetService.register(new DatasetRequestDTO("holes", null, List.of(
                new SampleInputDTO(List.of(0.1), 0),
                new SampleInputDTO(null, 1)
        ))))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Sample 1");
    }

    @Test
    void register_raggedFeatures_isValidationError() {
        when(datasetRepository.existsByName("ragged")).thenReturn(false);

        assertThatThrownBy(() -> datasetService.register(new DatasetRequestDTO("ragged", null, List.of(
                new SampleInputDTO(List.of(0.1, 0.2), 0),
                new SampleInputDTO(List.of(0.3), 1)
        ))))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("expected 2");
    }

    @Test
    void register_duplicateName_isConflict() {
        when(datasetRepository.existsByName("iris")).thenReturn(true);

        assertThatThrownBy(() -> datasetService.register(new DatasetRequestDTO("iris", null, List.of(
                new SampleInputDTO(List.of(0.1), 0)
        ))))
                .isInstanceOf(ConflictException.class);
    }
}
