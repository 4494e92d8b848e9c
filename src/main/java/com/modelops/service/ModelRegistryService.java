package com.modelops.service;

import com.modelops.entity.ModelStage;
import com.modelops.entity.ModelVersionRecord;
import com.modelops.entity.RegisteredModel;
import com.modelops.exception.ConcurrentTransitionException;
import com.modelops.exception.ModelNotFoundException;
import com.modelops.exception.ModelValidationException;
import com.modelops.exception.RegistryStorageException;
import com.modelops.metrics.ModelMetricsExporter;
import com.modelops.repository.ModelVersionRepository;
import com.modelops.repository.RegisteredModelRepository;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Registry of model versions and their stages.
 *
 * <p>All writes for one model name are serialized: a per-name lock orders writers inside this
 * process and the {@link RegisteredModel} row's version counter rejects any writer that slipped
 * past it. Each write is a single transaction, so readers only ever observe committed states with
 * at most one {@link ModelStage#PRODUCTION} version per name.
 */
@Slf4j
@Service
public class ModelRegistryService {

    private final ModelVersionRepository versionRepository;
    private final RegisteredModelRepository modelRepository;
    private final RunMetricsService runMetricsService;
    private final ModelMetricsExporter metricsExporter;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final ConcurrentHashMap<String, ReentrantLock> nameLocks = new ConcurrentHashMap<>();

    private static final List<String> RACE_CONSTRAINTS = List.of(
        "uk_model_version", "uk_model_run", "registered_models_pkey", "primary key on public.registered_models");

    @Value("${registry.transition.max-attempts:3}")
    private int maxAttempts;

    @Value("${registry.transition.lock-timeout-ms:2000}")
    private long lockTimeoutMs;

    public ModelRegistryService(ModelVersionRepository versionRepository,
                                RegisteredModelRepository modelRepository,
                                RunMetricsService runMetricsService,
                                ModelMetricsExporter metricsExporter,
                                PlatformTransactionManager transactionManager) {
        this.versionRepository = versionRepository;
        this.modelRepository = modelRepository;
        this.runMetricsService = runMetricsService;
        this.metricsExporter = metricsExporter;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    public ModelVersionRecord register(String name, String runId, Map<String, Double> metrics) {
        requireName(name);
        MetricValidation.requireIdentifier(runId, "runId", MetricValidation.MAX_RUN_ID_LENGTH);
        MetricValidation.requireMetrics(metrics, "model '" + name + "' run '" + runId + "'");
        Map<String, Double> snapshot = new LinkedHashMap<>(metrics);

        ModelVersionRecord saved = mutate(name, "register", () -> {
            if (versionRepository.existsByNameAndRunId(name, runId)) {
                throw new ModelValidationException(
                    "Run '" + runId + "' is already registered for model '" + name + "'");
            }
            Instant now = Instant.now();
            RegisteredModel model = modelRepository.findById(name)
                .orElseGet(() -> RegisteredModel.builder().name(name).createdAt(now).build());
            int next = versionRepository.findMaxVersion(name).orElse(0) + 1;
            model.setLatestVersion(next);
            model.setUpdatedAt(now);
            modelRepository.save(model);
            return versionRepository.saveAndFlush(ModelVersionRecord.builder()
                .name(name)
                .version(next)
                .runId(runId)
                .metrics(snapshot)
                .stage(ModelStage.NONE)
                .createdAt(now)
                .updatedAt(now)
                .build());
        });
        log.info("Model version registered | name={} | version={} | runId={} | metrics={}",
                 name, saved.getVersion(), runId, snapshot);
        return saved;
    }

    public ModelVersionRecord registerFromRun(String name, String runId) {
        return register(name, runId, runMetricsService.getMetrics(runId));
    }

    public ModelVersionRecord getByStage(String name, ModelStage stage) {
        requireName(name);
        Objects.requireNonNull(stage, "stage");
        return read(() -> {
            requireModel(name);
            return versionRepository.findFirstByNameAndStageOrderByVersionDesc(name, stage)
                .orElseThrow(() -> ModelNotFoundException.stage(name, stage));
        });
    }

    public Optional<ModelVersionRecord> findProduction(String name) {
        requireName(name);
        return read(() -> versionRepository.findFirstByNameAndStageOrderByVersionDesc(name, ModelStage.PRODUCTION));
    }

    public ModelVersionRecord getVersion(String name, int version) {
        requireName(name);
        return read(() -> versionRepository.findByNameAndVersion(name, version)
            .orElseThrow(() -> ModelNotFoundException.version(name, version)));
    }

    public List<ModelVersionRecord> listVersions(String name) {
        requireName(name);
        return read(() -> {
            requireModel(name);
            return versionRepository.findByNameOrderByVersionAsc(name);
        });
    }

    public List<ModelSummary> listModels() {
        return read(() -> modelRepository.findAllByOrderByNameAsc().stream()
            .map(m -> new ModelSummary(
                m.getName(),
                versionRepository.countByName(m.getName()),
                m.getLatestVersion(),
                m.getProductionVersion(),
                m.getUpdatedAt()))
            .toList());
    }

    /** Publishes an externally measured metric for an existing version to the performance gauge. */
    public ModelVersionRecord reportPerformance(String name, int version, String metric, double value) {
        if (metric == null || metric.isBlank()) {
            throw new ModelValidationException("metric name must not be blank");
        }
        if (!Double.isFinite(value)) {
            throw new ModelValidationException(
                "metric '%s' for %s v%d must be finite, got %s".formatted(metric, name, version, value));
        }
        ModelVersionRecord record = getVersion(name, version);
        metricsExporter.updatePerformance(name, version, metric, value);
        log.info("Performance metric updated | name={} | version={} | {}={}", name, version, metric, value);
        return record;
    }

    public List<ModelVersionRecord> findByRunId(String runId) {
        MetricValidation.requireIdentifier(runId, "runId", MetricValidation.MAX_RUN_ID_LENGTH);
        return read(() -> versionRepository.findByRunId(runId));
    }

    /**
     * Archives the current production version of {@code name}, if any, and promotes
     * {@code version} in the same transaction.
     */
    public StageTransition transitionToProduction(String name, int version) {
        return promote(name, version, false, null);
    }

    /**
     * Like {@link #transitionToProduction} but only commits if the production version is still
     * {@code expectedProductionVersion} ({@code null} meaning no production version).
     *
     * @throws ConcurrentTransitionException if production changed since the caller read it
     */
    public StageTransition compareAndTransition(String name, int version, Integer expectedProductionVersion) {
        return promote(name, version, true, expectedProductionVersion);
    }

    public ModelVersionRecord demote(String name, int version, ModelStage toStage) {
        requireName(name);
        Objects.requireNonNull(toStage, "toStage");
        switch (toStage) {
            case PRODUCTION:
                return transitionToProduction(name, version).getPromoted();
            case NONE:
                throw new ModelValidationException(
                    "Model '" + name + "' version " + version + " cannot be moved back to stage None");
            case ARCHIVED:
            default:
                break;
        }

        ModelStage[] previousStage = new ModelStage[1];
        ModelVersionRecord archived = mutate(name, "archive", () -> {
            ModelVersionRecord target = versionRepository.findByNameAndVersion(name, version)
                .orElseThrow(() -> ModelNotFoundException.version(name, version));
            previousStage[0] = target.getStage();
            if (target.getStage() == ModelStage.ARCHIVED) {
                return target;
            }
            Instant now = Instant.now();
            RegisteredModel model = requireModel(name);
            if (target.getStage() == ModelStage.PRODUCTION) {
                model.setProductionVersion(null);
            }
            model.setUpdatedAt(now);
            modelRepository.save(model);
            target.setStage(ModelStage.ARCHIVED);
            target.setUpdatedAt(now);
            return versionRepository.saveAndFlush(target);
        });

        log.info("Model version archived | name={} | version={} | previousStage={}",
                 name, version, previousStage[0].getLabel());
        if (previousStage[0] == ModelStage.PRODUCTION) {
            metricsExporter.updateProductionVersion(name, null);
        }
        return archived;
    }

    private StageTransition promote(String name, int version, boolean checkExpected, Integer expected) {
        requireName(name);
        StageTransition transition = mutate(name, "promote", () -> {
            ModelVersionRecord target = versionRepository.findByNameAndVersion(name, version)
                .orElseThrow(() -> ModelNotFoundException.version(name, version));
            RegisteredModel model = requireModel(name);
            List<ModelVersionRecord> current = versionRepository.findByNameAndStage(name, ModelStage.PRODUCTION);
            Integer currentVersion = current.stream()
                .map(ModelVersionRecord::getVersion)
                .max(Integer::compare)
                .orElse(null);

            if (checkExpected && !Objects.equals(currentVersion, expected)) {
                throw new ConcurrentTransitionException(String.format(
                    "Production version of model '%s' changed before version %d could be promoted "
                        + "(expected %s, found %s)", name, version, describe(expected), describe(currentVersion)));
            }
            if (target.getStage() == ModelStage.PRODUCTION && current.size() == 1) {
                return new StageTransition(target, null);
            }

            Instant now = Instant.now();
            ModelVersionRecord demoted = null;
            for (ModelVersionRecord previous : current) {
                if (previous.getVersion() == version) {
                    continue;
                }
                previous.setStage(ModelStage.ARCHIVED);
                previous.setUpdatedAt(now);
                versionRepository.save(previous);
                if (demoted == null || previous.getVersion() > demoted.getVersion()) {
                    demoted = previous;
                }
            }
            target.setStage(ModelStage.PRODUCTION);
            target.setUpdatedAt(now);
            versionRepository.save(target);
            model.setProductionVersion(version);
            model.setUpdatedAt(now);
            modelRepository.saveAndFlush(model);
            return new StageTransition(target, demoted);
        });

        if (transition.getDemoted().isPresent()) {
            log.info("Model promoted to Production | name={} | version={} | archived={}",
                     name, version, transition.getDemoted().get().getVersion());
        } else {
            log.info("Model promoted to Production | name={} | version={}", name, version);
        }
        metricsExporter.updateProductionVersion(name, version);
        return transition;
    }

    private <T> T mutate(String name, String operation, Supplier<T> work) {
        ReentrantLock lock = nameLocks.computeIfAbsent(name, n -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ConcurrentTransitionException(
                "Interrupted while waiting to " + operation + " model '" + name + "'", ex);
        }
        if (!acquired) {
            throw new ConcurrentTransitionException(String.format(
                "Another update of model '%s' is in flight; could not %s within %d ms",
                name, operation, lockTimeoutMs));
        }
        try {
            int attempts = Math.max(1, maxAttempts);
            for (int attempt = 1; ; attempt++) {
                try {
                    return writeTx.execute(status -> work.get());
                } catch (OptimisticLockingFailureException | DataIntegrityViolationException ex) {
                    if (ex instanceof DataIntegrityViolationException integrity && !isWriteRace(integrity)) {
                        throw new RegistryStorageException(
                            "Registry rejected " + operation + " of model '" + name + "': "
                                + integrity.getMostSpecificCause().getMessage(), ex);
                    }
                    if (attempt >= attempts) {
                        throw new ConcurrentTransitionException(String.format(
                            "Could not %s model '%s' after %d attempts: concurrent writers kept conflicting",
                            operation, name, attempt), ex);
                    }
                    log.warn("Registry write conflict, retrying | name={} | operation={} | attempt={} | cause={}",
                             name, operation, attempt, ex.getClass().getSimpleName());
                } catch (DataAccessException | TransactionException ex) {
                    throw new RegistryStorageException(
                        "Registry storage failed during " + operation + " of model '" + name + "'", ex);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        try {
            return readTx.execute(status -> query.get());
        } catch (DataAccessException | TransactionException ex) {
            throw new RegistryStorageException("Registry storage read failed", ex);
        }
    }

    private RegisteredModel requireModel(String name) {
        return modelRepository.findById(name).orElseThrow(() -> ModelNotFoundException.model(name));
    }

    private static void requireName(String name) {
        MetricValidation.requireIdentifier(name, "Model name", MetricValidation.MAX_NAME_LENGTH);
    }

    /**
     * Only a collision on the per-name keys means another writer got there first; any other
     * integrity failure would repeat on every attempt.
     */
    static boolean isWriteRace(DataIntegrityViolationException ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && violation.getConstraintName() != null
                    && namesRaceConstraint(violation.getConstraintName())) {
                return true;
            }
            if (cause.getMessage() != null && namesRaceConstraint(cause.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean namesRaceConstraint(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return RACE_CONSTRAINTS.stream().anyMatch(lower::contains);
    }

    private static String describe(Integer version) {
        return version == null ? "none" : "v" + version;
    }
}
