package com.sldce.backend.entities;

import java.time.LocalDateTime;
import java.util.List;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.sldce.backend.converters.FeatureVectorConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "samples",
        indexes = {
                @Index(name = "idx_sample_dataset_index", columnList = "dataset_id, sample_index")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Sample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    @Column(name = "sample_index", nullable = false)
    private int sampleIndex;

    @Convert(converter = FeatureVectorConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<Double> features;

    // ground truth at ingestion, never rewritten
    @Column(name = "original_label", nullable = false, updatable = false)
    private int originalLabel;

    @Column(name = "current_label", nullable = false)
    private int currentLabel;

    @Column(nullable = false)
    @Builder.Default
    private boolean suspicious = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean corrected = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
