package com.modelops.repository;

import com.modelops.entity.RunMetricsRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RunMetricsRepository extends JpaRepository<RunMetricsRecord, String> {
}
