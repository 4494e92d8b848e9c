package com.modelops.service;

import com.modelops.dto.PromotionResponse;
import com.modelops.entity.ModelVersionRecord;
import com.modelops.exception.ConcurrentTransitionException;
import com.modelops.exception.ModelNotFoundException;
import com.modelops.exception.ModelValidationException;
import com.modelops.metrics.ModelMetricsExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies {@link PromotionPolicy} against the registry.
 *
 * <p>The read-compare-transition cycle is not atomic; the transition re-checks at commit time
 * that production is still the version that was compared, and the whole cycle is retried a
 * bounded number of times when it is not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionService {

    private final ModelRegistryService registry;
    private final PromotionPolicy policy;
    private final ModelMetricsExporter metricsExporter;

    @Value("${registry.promotion.max-attempts:3}")
    private int maxAttempts;

    public PromotionResponse autoPromoteIfBetter(String runId, String metricName, boolean higherIsBetter) {
        return autoPromoteIfBetter(resolveCandidate(runId), metricName, higherIsBetter);
    }

    public PromotionResponse autoPromoteIfBetter(String name, String runId, String metricName, boolean higherIsBetter) {
        ModelVersionRecord candidate = registry.findByRunId(runId).stream()
            .filter(v -> v.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> ModelNotFoundException.run(runId));
        return autoPromoteIfBetter(candidate, metricName, higherIsBetter);
    }

    private PromotionResponse autoPromoteIfBetter(ModelVersionRecord candidate, String metricName,
                                                  boolean higherIsBetter) {
        if (metricName == null || metricName.isBlank()) {
            throw new ModelValidationException("metricName must not be blank");
        }
        String name = candidate.getName();
        int attempts = Math.max(1, maxAttempts);
        ConcurrentTransitionException lastConflict = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<ModelVersionRecord> production = registry.findProduction(name);
            PromotionDecision decision = policy.decide(candidate, production.orElse(null), metricName, higherIsBetter);
            Integer productionVersion = production.map(ModelVersionRecord::getVersion).orElse(null);
            PromotionResponse.PromotionResponseBuilder outcome = PromotionResponse.builder()
                .modelName(name)
                .runId(candidate.getRunId())
                .candidateVersion(candidate.getVersion())
                .previousProductionVersion(productionVersion)
                .metricName(metricName)
                .higherIsBetter(higherIsBetter)
                .candidateValue(decision.candidateValue())
                .productionValue(decision.productionValue())
                .reason(decision.reason())
                .attempts(attempt);

            if (!decision.promote()) {
                log.info("Candidate not promoted | name={} | version={} | metric={} | candidate={} | production=v{}:{} | reason={}",
                         name, candidate.getVersion(), metricName, decision.candidateValue(),
                         productionVersion, decision.productionValue(), decision.reason());
                return outcome.promoted(false).build();
            }

            try {
                registry.compareAndTransition(name, candidate.getVersion(), productionVersion);
            } catch (ConcurrentTransitionException ex) {
                lastConflict = ex;
                log.warn("Promotion raced with another writer, re-evaluating | name={} | version={} | attempt={}/{} | cause={}",
                         name, candidate.getVersion(), attempt, attempts, ex.getMessage());
                continue;
            }

            if (decision.candidateValue() != null) {
                metricsExporter.updatePerformance(name, candidate.getVersion(), metricName, decision.candidateValue());
            }
            log.info("Candidate promoted | name={} | version={} | metric={} | candidate={} | previous=v{}:{} | reason={}",
                     name, candidate.getVersion(), metricName, decision.candidateValue(),
                     productionVersion, decision.productionValue(), decision.reason());
            return outcome.promoted(true).build();
        }

        throw new ConcurrentTransitionException(String.format(
            "Promotion of model '%s' version %d on '%s' did not settle after %d attempts; "
                + "re-run the comparison against the current production version",
            name, candidate.getVersion(), metricName, attempts), lastConflict);
    }

    private ModelVersionRecord resolveCandidate(String runId) {
        List<ModelVersionRecord> matches = registry.findByRunId(runId);
        if (matches.isEmpty()) {
            throw ModelNotFoundException.run(runId);
        }
        if (matches.size() > 1) {
            throw new ModelValidationException(String.format(
                "Run '%s' is registered under several models %s; pass the model name explicitly",
                runId, matches.stream().map(ModelVersionRecord::getName).toList()));
        }
        return matches.get(0);
    }
}
