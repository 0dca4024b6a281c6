package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.dataset.DatasetRequestDTO;
import com.sldce.backend.dto.dataset.DatasetResponseDTO;
import com.sldce.backend.dto.dataset.SampleResponseDTO;
import com.sldce.backend.services.DatasetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
public class DatasetController {

    private final DatasetService datasetService;

    @PostMapping
    public ResponseEntity<ApiResponse<DatasetResponseDTO>> register(
            @Valid @RequestBody DatasetRequestDTO dto
    ) {
        DatasetResponseDTO created = datasetService.register(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Dataset registered"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<DatasetResponseDTO>>> findAll() {
        return ResponseEntity.ok(ApiResponse.success(datasetService.findAll(), "Datasets found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DatasetResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(datasetService.findById(id), "Dataset found"));
    }

    @GetMapping("/{id}/samples")
    public ResponseEntity<ApiResponse<List<SampleResponseDTO>>> listSamples(
            @PathVariable Long id,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        List<SampleResponseDTO> list = datasetService.listSamples(id, limit, offset);
        return ResponseEntity.ok(ApiResponse.success(list, "Samples found"));
    }

    @GetMapping("/{id}/labels")
    public ResponseEntity<ApiResponse<List<Integer>>> knownLabels(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(datasetService.knownLabels(id), "Known labels"));
    }
}
