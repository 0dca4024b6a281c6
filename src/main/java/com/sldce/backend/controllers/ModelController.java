package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.model.ModelComparisonDTO;
import com.sldce.backend.dto.model.ModelRequestDTO;
import com.sldce.backend.dto.model.ModelResponseDTO;
import com.sldce.backend.services.ModelService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

    private final ModelService modelService;

    @PostMapping
    public ResponseEntity<ApiResponse<ModelResponseDTO>> register(@Valid @RequestBody ModelRequestDTO dto) {
        ModelResponseDTO created = modelService.register(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Model registered"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ModelResponseDTO>>> list(@RequestParam(required = false) Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(modelService.listModels(datasetId), "Models found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ModelResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(modelService.getModel(id), "Model found"));
    }

    @GetMapping("/compare/{datasetId}")
    public ResponseEntity<ApiResponse<ModelComparisonDTO>> compare(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(modelService.compareModels(datasetId), "Model comparison"));
    }
}
