package com.sldce.backend.repositories;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Sample;

import jakarta.persistence.LockModeType;

@Repository
public interface SampleRepository extends JpaRepository<Sample, Long> {

    List<Sample> findByDatasetIdOrderBySampleIndexAscIdAsc(Long datasetId);

    long countByDatasetId(Long datasetId);

    long countByDatasetIdAndSuspiciousTrue(Long datasetId);

    @Query("select distinct s.originalLabel from Sample s where s.dataset.id = :datasetId order by s.originalLabel")
    List<Integer> findDistinctOriginalLabels(@Param("datasetId") Long datasetId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Sample s where s.id in :ids order by s.id")
    List<Sample> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
