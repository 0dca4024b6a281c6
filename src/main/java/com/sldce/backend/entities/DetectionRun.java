package com.sldce.backend.entities;

import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row per detection iteration of a dataset. The unique (dataset_id, iteration) pair is what keeps two
 * concurrent runs from claiming the same iteration number.
 */
@Entity
@Table(
        name = "detection_runs",
        uniqueConstraints = @UniqueConstraint(name = "ux_detection_run_dataset_iteration", columnNames = {"dataset_id", "iteration"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DetectionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, updatable = false)
    private Long datasetId;

    @Column(nullable = false, updatable = false)
    private int iteration;

    @Column(name = "confidence_threshold", nullable = false, updatable = false)
    private double confidenceThreshold;

    @Column(name = "confidence_weight", nullable = false, updatable = false)
    private double confidenceWeight;

    @Column(name = "anomaly_weight", nullable = false, updatable = false)
    private double anomalyWeight;

    @Column(name = "max_samples", updatable = false)
    private Integer maxSamples;

    @Column(name = "total_samples_analyzed", nullable = false, updatable = false)
    private int totalSamplesAnalyzed;

    @Column(name = "suspicious_samples_found", nullable = false, updatable = false)
    private int suspiciousSamplesFound;

    @Column(name = "detection_rate", nullable = false, updatable = false)
    private double detectionRate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
