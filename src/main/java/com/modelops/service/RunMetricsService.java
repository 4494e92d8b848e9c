package com.modelops.service;

import com.modelops.entity.RunMetricsRecord;
import com.modelops.exception.ModelNotFoundException;
import com.modelops.exception.RegistryStorageException;
import com.modelops.repository.RunMetricsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable {@code run_id -> metrics} snapshots written by training jobs.
 *
 * <p>Writes commit inside {@link #logMetrics}, so every storage failure surfaces here as a
 * {@link RegistryStorageException}. Two first writes for the same run race on the primary key;
 * the loser re-reads the winner's row and merges into it.
 */
@Slf4j
@Service
public class RunMetricsService {

    private static final int WRITE_ATTEMPTS = 2;

    private final RunMetricsRepository repository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public RunMetricsService(RunMetricsRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    public RunMetricsRecord logMetrics(String runId, Map<String, Double> metrics) {
        requireRunId(runId);
        MetricValidation.requireMetrics(metrics, "run '" + runId + "'");
        for (int attempt = 1; ; attempt++) {
            try {
                RunMetricsRecord saved = writeTx.execute(status -> {
                    RunMetricsRecord record = repository.findById(runId)
                        .orElseGet(() -> RunMetricsRecord.builder().runId(runId).build());
                    record.getMetrics().putAll(metrics);
                    record.setUpdatedAt(Instant.now());
                    return repository.saveAndFlush(record);
                });
                log.info("Run metrics logged | runId={} | metrics={}", runId, metrics.keySet());
                return saved;
            } catch (DataIntegrityViolationException ex) {
                if (attempt >= WRITE_ATTEMPTS) {
                    throw new RegistryStorageException("Failed to store metrics for run '" + runId + "'", ex);
                }
                log.warn("Run metrics write collided, merging into existing snapshot | runId={} | cause={}",
                         runId, ex.getMostSpecificCause().getMessage());
            } catch (DataAccessException | TransactionException ex) {
                throw new RegistryStorageException("Failed to store metrics for run '" + runId + "'", ex);
            }
        }
    }

    public Map<String, Double> getMetrics(String runId) {
        requireRunId(runId);
        try {
            return readTx.execute(status -> repository.findById(runId)
                .map(record -> new LinkedHashMap<>(record.getMetrics()))
                .orElseThrow(() -> ModelNotFoundException.run(runId)));
        } catch (DataAccessException | TransactionException ex) {
            throw new RegistryStorageException("Failed to read metrics for run '" + runId + "'", ex);
        }
    }

    private void requireRunId(String runId) {
        MetricValidation.requireIdentifier(runId, "runId", MetricValidation.MAX_RUN_ID_LENGTH);
    }
}
