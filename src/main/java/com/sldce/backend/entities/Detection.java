package com.sldce.backend.entities;

import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A suspicious sample of one detection iteration. Never updated after insert.
 */
@Entity
@Table(
        name = "detections",
        uniqueConstraints = @UniqueConstraint(name = "ux_detection_sample_iteration", columnNames = {"sample_id", "iteration"}),
        indexes = {
                @Index(name = "idx_detection_dataset_iteration_rank", columnList = "dataset_id, iteration, detection_rank")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Detection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sample_id", nullable = false, updatable = false)
    private Sample sample;

    @Column(name = "dataset_id", nullable = false, updatable = false)
    private Long datasetId;

    @Column(nullable = false, updatable = false)
    private int iteration;

    @Column(name = "confidence_score", nullable = false, updatable = false)
    private double confidenceScore;

    @Column(name = "anomaly_score", nullable = false, updatable = false)
    private double anomalyScore;

    @Column(name = "priority_score", nullable = false, updatable = false)
    private double priorityScore;

    @Column(name = "predicted_label", nullable = false, updatable = false)
    private int predictedLabel;

    @Column(name = "detection_rank", nullable = false, updatable = false)
    private int rank;

    @Column(name = "confidence_weight", nullable = false, updatable = false)
    private double confidenceWeight;

    @Column(name = "anomaly_weight", nullable = false, updatable = false)
    private double anomalyWeight;

    @CreationTimestamp
    @Column(name = "detected_at", updatable = false)
    private LocalDateTime detectedAt;
}
