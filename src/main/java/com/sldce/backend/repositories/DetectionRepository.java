package com.sldce.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Detection;

@Repository
public interface DetectionRepository extends JpaRepository<Detection, Long> {

    List<Detection> findByDatasetIdAndIterationOrderByRankAsc(Long datasetId, int iteration);

    List<Detection> findByDatasetId(Long datasetId);

    long countByDatasetId(Long datasetId);

    long countByDatasetIdAndPriorityScoreGreaterThanEqual(Long datasetId, double priorityScore);

    @Query("select avg(d.confidenceScore) from Detection d where d.datasetId = :datasetId")
    Double averageConfidence(@Param("datasetId") Long datasetId);

    @Query("""
            select d from Detection d
            where (:datasetId is null or d.datasetId = :datasetId)
              and (:iteration is null or d.iteration = :iteration)
              and (:minPriority is null or d.priorityScore >= :minPriority)
              and (:minConfidence is null or d.confidenceScore >= :minConfidence)
              and (:minAnomaly is null or d.anomalyScore >= :minAnomaly)
            order by d.iteration desc, d.rank asc
            """)
    List<Detection> search(
            @Param("datasetId") Long datasetId,
            @Param("iteration") Integer iteration,
            @Param("minPriority") Double minPriority,
            @Param("minConfidence") Double minConfidence,
            @Param("minAnomaly") Double minAnomaly
    );
}
