package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.correction.CorrectionApplyResultDTO;
import com.sldce.backend.dto.correction.CorrectionPreviewDTO;
import com.sldce.backend.dto.correction.CorrectionSummaryDTO;
import com.sldce.backend.services.CorrectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/corrections")
@RequiredArgsConstructor
public class CorrectionController {

    private final CorrectionService correctionService;

    @GetMapping("/preview/{datasetId}")
    public ResponseEntity<ApiResponse<CorrectionPreviewDTO>> preview(
            @PathVariable Long datasetId,
            @RequestParam int iteration
    ) {
        CorrectionPreviewDTO preview = correctionService.previewCorrections(datasetId, iteration);
        return ResponseEntity.ok(ApiResponse.success(preview, "Correction preview"));
    }

    @PostMapping("/apply/{datasetId}")
    public ResponseEntity<ApiResponse<CorrectionApplyResultDTO>> apply(
            @PathVariable Long datasetId,
            @RequestParam int iteration
    ) {
        CorrectionApplyResultDTO result = correctionService.applyCorrections(datasetId, iteration);
        return ResponseEntity.ok(ApiResponse.success(result, "Corrections applied"));
    }

    @GetMapping("/summary/{datasetId}")
    public ResponseEntity<ApiResponse<CorrectionSummaryDTO>> summary(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(correctionService.getCorrectionSummary(datasetId), "Correction summary"));
    }
}
