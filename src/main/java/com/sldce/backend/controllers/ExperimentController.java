package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.experiment.ExperimentIterationRequestDTO;
import com.sldce.backend.dto.experiment.ExperimentIterationResponseDTO;
import com.sldce.backend.dto.experiment.ExperimentRequestDTO;
import com.sldce.backend.dto.experiment.ExperimentResponseDTO;
import com.sldce.backend.dto.experiment.ExperimentSummaryDTO;
import com.sldce.backend.services.ExperimentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/experiments")
@RequiredArgsConstructor
public class ExperimentController {

    private final ExperimentService experimentService;

    @PostMapping
    public ResponseEntity<ApiResponse<ExperimentResponseDTO>> create(@Valid @RequestBody ExperimentRequestDTO dto) {
        ExperimentResponseDTO created = experimentService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Experiment created"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ExperimentResponseDTO>>> list(
            @RequestParam(required = false) Long datasetId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        return ResponseEntity.ok(ApiResponse.success(
                experimentService.listExperiments(datasetId, limit, offset), "Experiments found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExperimentResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(experimentService.getExperiment(id), "Experiment found"));
    }

    @PostMapping("/{id}/iterations")
    public ResponseEntity<ApiResponse<ExperimentIterationResponseDTO>> recordIteration(
            @PathVariable Long id,
            @Valid @RequestBody ExperimentIterationRequestDTO dto
    ) {
        ExperimentIterationResponseDTO created = experimentService.recordIteration(id, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Iteration recorded"));
    }

    @GetMapping("/{id}/iterations")
    public ResponseEntity<ApiResponse<List<ExperimentIterationResponseDTO>>> iterations(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(experimentService.listIterations(id), "Iterations found"));
    }

    @GetMapping("/{id}/summary")
    public ResponseEntity<ApiResponse<ExperimentSummaryDTO>> summary(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(experimentService.getSummary(id), "Experiment summary"));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse<ExperimentResponseDTO>> complete(
            @PathVariable Long id,
            @RequestParam(required = false) Double totalTimeSeconds
    ) {
        return ResponseEntity.ok(ApiResponse.success(
                experimentService.complete(id, totalTimeSeconds), "Experiment completed"));
    }
}
