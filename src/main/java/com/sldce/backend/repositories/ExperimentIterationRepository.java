package com.sldce.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.ExperimentIteration;

@Repository
public interface ExperimentIterationRepository extends JpaRepository<ExperimentIteration, Long> {

    List<ExperimentIteration> findByExperimentIdOrderByIterationNumberAsc(Long experimentId);
}
