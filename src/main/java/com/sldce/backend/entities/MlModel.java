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
 * Metadata of a classifier trained outside this service, kept for before/after comparison.
 */
@Entity
@Table(
        name = "ml_models",
        uniqueConstraints = @UniqueConstraint(name = "ux_ml_model_dataset_name", columnNames = {"dataset_id", "name"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MlModel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(nullable = false)
    private String name;

    @Column(name = "model_type", nullable = false, length = 100)
    private String modelType;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private int iteration;

    @Column(nullable = false)
    @Builder.Default
    private boolean baseline = false;

    @Column(name = "train_accuracy")
    private Double trainAccuracy;

    @Column(name = "test_accuracy")
    private Double testAccuracy;

    @Column(name = "precision_score")
    private Double precision;

    @Column(name = "recall_score")
    private Double recall;

    @Column(name = "f1_score")
    private Double f1Score;

    @Column(name = "num_samples_trained")
    private Integer numSamplesTrained;

    @Column(name = "samples_corrected")
    private Integer samplesCorrected;

    @Column(name = "training_time_seconds")
    private Double trainingTimeSeconds;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public double effectiveAccuracy() {
        if (testAccuracy != null) return testAccuracy;
        if (trainAccuracy != null) return trainAccuracy;
        return 0.0;
    }
}
