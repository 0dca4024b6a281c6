package com.sldce.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Feedback;
import com.sldce.backend.enums.FeedbackAction;

@Repository
public interface FeedbackRepository extends JpaRepository<Feedback, Long> {

    long countBySuggestionId(Long suggestionId);

    long countByDatasetId(Long datasetId);

    long countByDatasetIdAndAction(Long datasetId, FeedbackAction action);

    List<Feedback> findByDatasetIdAndIterationOrderByIdAsc(Long datasetId, int iteration);

    @Query("""
            select f from Feedback f join fetch f.sample s
            where f.datasetId = :datasetId and f.iteration = :iteration
            order by s.id asc, f.id asc
            """)
    List<Feedback> findWithSampleByDatasetIdAndIteration(
            @Param("datasetId") Long datasetId,
            @Param("iteration") int iteration
    );

    @Query("""
            select f from Feedback f join fetch f.suggestion s join fetch s.detection d
            where f.datasetId = :datasetId
              and (:iteration is null or f.iteration = :iteration)
            order by f.id asc
            """)
    List<Feedback> findWithDetectionByDatasetId(
            @Param("datasetId") Long datasetId,
            @Param("iteration") Integer iteration
    );

    @Query("""
            select f from Feedback f
            where (:datasetId is null or f.datasetId = :datasetId)
              and (:iteration is null or f.iteration = :iteration)
              and (:action is null or f.action = :action)
            order by f.createdAt desc, f.id desc
            """)
    List<Feedback> search(
            @Param("datasetId") Long datasetId,
            @Param("iteration") Integer iteration,
            @Param("action") FeedbackAction action
    );
}
