package com.sldce.backend.entities;

import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.sldce.backend.enums.ExperimentStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A cleaning campaign on one dataset, tracked iteration by iteration.
 */
@Entity
@Table(
        name = "experiments",
        uniqueConstraints = @UniqueConstraint(name = "ux_experiment_dataset_name", columnNames = {"dataset_id", "name"}),
        indexes = {
                @Index(name = "idx_experiment_dataset", columnList = "dataset_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Experiment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, updatable = false)
    private Long datasetId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ExperimentStatus status = ExperimentStatus.RUNNING;

    // label noise injected into the dataset, in percent
    @Column(name = "noise_percentage", nullable = false, updatable = false)
    private double noisePercentage;

    @Column(name = "detection_threshold", nullable = false, updatable = false)
    private double detectionThreshold;

    @Column(name = "max_iterations", nullable = false, updatable = false)
    private int maxIterations;

    @Column(name = "current_iteration", nullable = false)
    @Builder.Default
    private int currentIteration = 0;

    @Column(name = "baseline_accuracy")
    private Double baselineAccuracy;

    @Column(name = "final_accuracy")
    private Double finalAccuracy;

    @Column(name = "total_corrections", nullable = false)
    @Builder.Default
    private int totalCorrections = 0;

    @Column(name = "total_time_seconds")
    private Double totalTimeSeconds;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
