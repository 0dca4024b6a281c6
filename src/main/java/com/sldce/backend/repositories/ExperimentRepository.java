package com.sldce.backend.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Experiment;

import jakarta.persistence.LockModeType;

@Repository
public interface ExperimentRepository extends JpaRepository<Experiment, Long> {

    boolean existsByDatasetIdAndName(Long datasetId, String name);

    List<Experiment> findAllByOrderByCreatedAtDescIdDesc();

    List<Experiment> findByDatasetIdOrderByCreatedAtDescIdDesc(Long datasetId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Experiment e where e.id = :id")
    Optional<Experiment> findByIdForUpdate(@Param("id") Long id);
}
