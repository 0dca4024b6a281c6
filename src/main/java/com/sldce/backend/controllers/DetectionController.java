package com.sldce.backend.controllers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.dto.detection.*;
import com.sldce.backend.enums.SignalType;
import com.sldce.backend.services.DetectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/detection")
@RequiredArgsConstructor
public class DetectionController {

    private final DetectionService detectionService;

    @PostMapping("/run")
    public ResponseEntity<ApiResponse<DetectionRunResultDTO>> run(@Valid @RequestBody DetectionRunRequestDTO dto) {
        DetectionRunResultDTO result = detectionService.runDetection(
                dto.datasetId(),
                dto.confidenceThreshold(),
                dto.confidenceWeight(),
                dto.anomalyWeight(),
                dto.maxSamples()
        );
        return ResponseEntity.ok(ApiResponse.success(result, "Detection completed"));
    }

    @GetMapping("/list")
    public ResponseEntity<ApiResponse<List<DetectionResponseDTO>>> list(
            @RequestParam(required = false) Long datasetId,
            @RequestParam(required = false) Integer iteration,
            @RequestParam(required = false) Double minPriority,
            @RequestParam(required = false) Double minConfidence,
            @RequestParam(required = false) Double minAnomaly,
            @RequestParam(required = false) SignalType signalType,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        List<DetectionResponseDTO> list = detectionService.listDetections(
                datasetId, iteration, minPriority, minConfidence, minAnomaly, signalType, limit, offset);
        return ResponseEntity.ok(ApiResponse.success(list, "Detections found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DetectionDetailsDTO>> details(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(detectionService.getDetectionDetails(id), "Detection found"));
    }

    @GetMapping("/runs/{datasetId}")
    public ResponseEntity<ApiResponse<List<DetectionRunDTO>>> runs(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(detectionService.listRuns(datasetId), "Detection runs found"));
    }

    @GetMapping("/stats/{datasetId}")
    public ResponseEntity<ApiResponse<DetectionStatsDTO>> stats(@PathVariable Long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(detectionService.getDetectionStats(datasetId), "Detection statistics"));
    }

    @GetMapping("/signal-stats/{datasetId}")
    public ResponseEntity<ApiResponse<SignalStatsDTO>> signalStats(
            @PathVariable Long datasetId,
            @RequestParam(required = false) Integer iteration
    ) {
        SignalStatsDTO stats = detectionService.getSignalStats(datasetId, iteration);
        return ResponseEntity.ok(ApiResponse.success(stats, "Signal statistics"));
    }
}
