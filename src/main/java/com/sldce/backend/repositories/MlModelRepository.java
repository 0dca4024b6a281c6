package com.sldce.backend.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.MlModel;

@Repository
public interface MlModelRepository extends JpaRepository<MlModel, Long> {

    boolean existsByDatasetIdAndName(Long datasetId, String name);

    Optional<MlModel> findByIdAndActiveTrue(Long id);

    List<MlModel> findByActiveTrueOrderByCreatedAtDesc();

    List<MlModel> findByDatasetIdAndActiveTrueOrderByCreatedAtDesc(Long datasetId);

    List<MlModel> findByDatasetIdAndActiveTrueOrderByIterationAscCreatedAtAscIdAsc(Long datasetId);
}
