package com.modelops.service;

import com.modelops.entity.ModelVersionRecord;
import com.modelops.exception.ModelValidationException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides whether a candidate version should replace the production version. Holds no state and
 * touches no storage.
 */
@Component
public class PromotionPolicy {

    public PromotionDecision decide(ModelVersionRecord candidate, ModelVersionRecord production,
                                    String metricName, boolean higherIsBetter) {
        Objects.requireNonNull(candidate, "candidate");
        Double candidateValue = candidate.metric(metricName);
        if (production == null) {
            return new PromotionDecision(true, PromotionDecision.Reason.BOOTSTRAP, candidateValue, null);
        }
        Double productionValue = production.metric(metricName);
        if (production.getVersion() == candidate.getVersion()) {
            return new PromotionDecision(false, PromotionDecision.Reason.ALREADY_PRODUCTION,
                candidateValue, productionValue);
        }
        if (candidateValue == null) {
            throw new ModelValidationException(String.format(
                "Candidate '%s' v%d has no metric '%s' (available: %s)",
                candidate.getName(), candidate.getVersion(), metricName, candidate.getMetrics().keySet()));
        }
        if (productionValue == null) {
            throw new ModelValidationException(String.format(
                "Production '%s' v%d has no metric '%s' (available: %s)",
                production.getName(), production.getVersion(), metricName, production.getMetrics().keySet()));
        }
        boolean better = higherIsBetter ? candidateValue > productionValue : candidateValue < productionValue;
        return new PromotionDecision(better,
            better ? PromotionDecision.Reason.IMPROVED : PromotionDecision.Reason.NOT_BETTER,
            candidateValue, productionValue);
    }
}
