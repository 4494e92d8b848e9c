package com.modelops.service;

import com.modelops.entity.RunMetricsRecord;
import com.modelops.exception.ModelNotFoundException;
import com.modelops.exception.ModelValidationException;
import com.modelops.exception.RegistryStorageException;
import com.modelops.repository.RunMetricsRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunMetricsServiceTest {

    @Mock RunMetricsRepository       repository;
    @Mock PlatformTransactionManager transactionManager;
    @InjectMocks RunMetricsService   service;

    @Test
    void logMetrics_mergesIntoExistingSnapshot() {
        RunMetricsRecord existing = RunMetricsRecord.builder()
            .runId("run-1").metrics(new LinkedHashMap<>(Map.of("auc", 0.7))).build();
        when(repository.findById("run-1")).thenReturn(Optional.of(existing));
        when(repository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        RunMetricsRecord saved = service.logMetrics("run-1", Map.of("accuracy", 0.81, "auc", 0.72));

        assertThat(saved.getMetrics()).containsEntry("auc", 0.72).containsEntry("accuracy", 0.81);
        assertThat(saved.getUpdatedAt()).isNotNull();
    }

    @Test
    void logMetrics_firstWriteCollision_mergesIntoWinnersRow() {
        RunMetricsRecord winner = RunMetricsRecord.builder()
            .runId("run-1").metrics(new LinkedHashMap<>(Map.of("auc", 0.7))).build();
        when(repository.findById("run-1")).thenReturn(Optional.empty()).thenReturn(Optional.of(winner));
        when(repository.saveAndFlush(any()))
            .thenThrow(new DataIntegrityViolationException("duplicate key run_metrics_pkey"))
            .thenAnswer(inv -> inv.getArgument(0));

        RunMetricsRecord saved = service.logMetrics("run-1", Map.of("accuracy", 0.8));

        assertThat(saved.getMetrics()).containsOnlyKeys("auc", "accuracy");
        verify(repository, times(2)).saveAndFlush(any());
    }

    @Test
    void logMetrics_flushFailure_surfacesAsStorageError() {
        when(repository.findById("run-1")).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("value too long"));

        assertThatThrownBy(() -> service.logMetrics("run-1", Map.of("auc", 0.7)))
            .isInstanceOf(RegistryStorageException.class)
            .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void logMetrics_rejectsNonFiniteValues() {
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("auc", Double.NaN);
        assertThatThrownBy(() -> service.logMetrics("run-1", metrics))
            .isInstanceOf(ModelValidationException.class)
            .hasMessageContaining("auc");
        verifyNoInteractions(repository);
    }

    @Test
    void logMetrics_rejectsOversizedNames() {
        assertThatThrownBy(() -> service.logMetrics("run-1", Map.of("m".repeat(150), 0.7)))
            .isInstanceOf(ModelValidationException.class)
            .hasMessageContaining("100");
        assertThatThrownBy(() -> service.logMetrics("r".repeat(129), Map.of("auc", 0.7)))
            .isInstanceOf(ModelValidationException.class)
            .hasMessageContaining("128");
        verifyNoInteractions(repository);
    }

    @Test
    void logMetrics_rejectsEmptyMetrics() {
        assertThatThrownBy(() -> service.logMetrics("run-1", Map.of()))
            .isInstanceOf(ModelValidationException.class);
    }

    @Test
    void getMetrics_unknownRun_throwsNotFound() {
        when(repository.findById("nope")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.getMetrics("nope")).isInstanceOf(ModelNotFoundException.class);
    }

    @Test
    void getMetrics_storageFailure_wrapped() {
        when(repository.findById("run-1")).thenThrow(new DataAccessResourceFailureException("db down"));
        assertThatThrownBy(() -> service.getMetrics("run-1"))
            .isInstanceOf(RegistryStorageException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
