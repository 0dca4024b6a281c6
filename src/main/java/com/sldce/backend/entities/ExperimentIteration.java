package com.sldce.backend.entities;

import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "experiment_iterations",
        uniqueConstraints = @UniqueConstraint(name = "ux_experiment_iteration_number", columnNames = {"experiment_id", "iteration_number"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExperimentIteration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "experiment_id", nullable = false, updatable = false)
    private Experiment experiment;

    @Column(name = "iteration_number", nullable = false, updatable = false)
    private int iterationNumber;

    @Column(nullable = false, updatable = false)
    private double accuracy;

    @Column(name = "precision_score", updatable = false)
    private Double precision;

    @Column(name = "recall_score", updatable = false)
    private Double recall;

    @Column(name = "f1_score", updatable = false)
    private Double f1Score;

    @Column(name = "samples_flagged", nullable = false, updatable = false)
    private int samplesFlagged;

    @Column(name = "samples_reviewed", nullable = false, updatable = false)
    private int samplesReviewed;

    @Column(name = "samples_corrected", nullable = false, updatable = false)
    private int samplesCorrected;

    @Column(name = "correction_acceptance_rate", updatable = false)
    private Double correctionAcceptanceRate;

    @Column(name = "remaining_noise_percentage", updatable = false)
    private Double remainingNoisePercentage;

    @Column(name = "iteration_time_seconds", updatable = false)
    private Double iterationTimeSeconds;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
