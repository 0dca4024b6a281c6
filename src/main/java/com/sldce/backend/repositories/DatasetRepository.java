package com.sldce.backend.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sldce.backend.entities.Dataset;

import jakarta.persistence.LockModeType;

@Repository
public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    boolean existsByName(String name);

    List<Dataset> findByActiveTrueOrderByCreatedAtDesc();

    /**
     * Serializes detection runs of the same dataset.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Dataset d where d.id = :id")
    Optional<Dataset> findByIdForUpdate(@Param("id") Long id);
}
