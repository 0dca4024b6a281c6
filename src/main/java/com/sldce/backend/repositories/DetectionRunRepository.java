package com.sldce.backend.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.DetectionRun;

import jakarta.persistence.LockModeType;

@Repository
public interface DetectionRunRepository extends JpaRepository<DetectionRun, Long> {

    @Query("select max(r.iteration) from DetectionRun r where r.datasetId = :datasetId")
    Integer findMaxIteration(@Param("datasetId") Long datasetId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from DetectionRun r where r.datasetId = :datasetId and r.iteration = :iteration")
    Optional<DetectionRun> findByDatasetIdAndIterationForUpdate(
            @Param("datasetId") Long datasetId,
            @Param("iteration") int iteration
    );

    List<DetectionRun> findByDatasetIdOrderByIterationDesc(Long datasetId);
}
