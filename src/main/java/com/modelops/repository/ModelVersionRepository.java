package com.modelops.repository;

import com.modelops.entity.ModelStage;
import com.modelops.entity.ModelVersionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ModelVersionRepository extends JpaRepository<ModelVersionRecord, UUID> {

    Optional<ModelVersionRecord> findByNameAndVersion(String name, int version);

    Optional<ModelVersionRecord> findFirstByNameAndStageOrderByVersionDesc(String name, ModelStage stage);

    List<ModelVersionRecord> findByNameAndStage(String name, ModelStage stage);

    List<ModelVersionRecord> findByNameOrderByVersionAsc(String name);

    List<ModelVersionRecord> findByRunId(String runId);

    boolean existsByNameAndRunId(String name, String runId);

    long countByName(String name);

    @Query("SELECT MAX(v.version) FROM ModelVersionRecord v WHERE v.name = :name")
    Optional<Integer> findMaxVersion(@Param("name") String name);
}
