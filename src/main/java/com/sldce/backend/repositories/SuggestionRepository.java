package com.sldce.backend.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.SuggestionStatus;

import jakarta.persistence.LockModeType;

@Repository
public interface SuggestionRepository extends JpaRepository<Suggestion, Long> {

    boolean existsByDetectionId(Long detectionId);

    long countByDetectionDatasetIdAndStatus(Long datasetId, SuggestionStatus status);

    /**
     * Review check-and-set: the status is read and written under this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Suggestion s where s.id = :id")
    Optional<Suggestion> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select s from Suggestion s join s.detection d
            where (:datasetId is null or d.datasetId = :datasetId)
              and (:iteration is null or d.iteration = :iteration)
              and (:status is null or s.status = :status)
              and (:minConfidence is null or s.confidence >= :minConfidence)
            order by s.confidence desc, s.id asc
            """)
    List<Suggestion> search(
            @Param("datasetId") Long datasetId,
            @Param("iteration") Integer iteration,
            @Param("status") SuggestionStatus status,
            @Param("minConfidence") Double minConfidence
    );
}
