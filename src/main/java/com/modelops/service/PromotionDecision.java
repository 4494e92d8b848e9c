package com.modelops.service;

public record PromotionDecision(boolean promote, Reason reason, Double candidateValue, Double productionValue) {

    public enum Reason {
        /** No version was in production. */
        BOOTSTRAP,
        IMPROVED,
        /** Equal or worse; ties never promote. */
        NOT_BETTER,
        ALREADY_PRODUCTION
    }
}
