package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.dataset.SampleResponseDTO;
import com.sldce.backend.services.DatasetService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/samples")
@RequiredArgsConstructor
public class SampleController {

    private final DatasetService datasetService;

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SampleResponseDTO>> findById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(datasetService.getSample(id), "Sample found"));
    }
}
