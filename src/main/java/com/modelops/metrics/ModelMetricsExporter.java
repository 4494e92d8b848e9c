package com.modelops.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Prometheus exposition of serving and model-quality metrics.
 *
 * <p>Holds no decision logic: the registry and the drift monitor push values in, scrapes read
 * them out. Gauge values live in strongly referenced holders keyed by their tag set.
 */
@Component
@RequiredArgsConstructor
public class ModelMetricsExporter {

    static final String PREDICTIONS = "model.predictions";
    static final String LATENCY = "model.prediction.latency";
    static final String DRIFT_SCORE = "model.data.drift.score";
    static final String PERFORMANCE = "model.performance.metric";
    static final String PRODUCTION_VERSION = "model.production.version";

    private final PrometheusMeterRegistry registry;
    private final ConcurrentHashMap<Tags, AtomicReference<Double>> driftScores = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Tags, AtomicReference<Double>> performance = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Tags, AtomicReference<Double>> productionVersions = new ConcurrentHashMap<>();

    public void recordPrediction(String modelVersion, String outcome, double latencySeconds) {
        Counter.builder(PREDICTIONS)
            .description("Total number of predictions made")
            .tags("model_version", modelVersion, "outcome", outcome)
            .register(registry)
            .increment();
        Timer.builder(LATENCY)
            .description("Prediction latency in seconds")
            .tags("model_version", modelVersion)
            .publishPercentileHistogram()
            .register(registry)
            .record(Duration.ofNanos(Math.round(latencySeconds * 1_000_000_000d)));
    }

    public void updateDriftScore(String feature, double score) {
        set(driftScores, DRIFT_SCORE, "Normalized drift score of a live feature against its reference",
            Tags.of("feature_name", feature), score);
    }

    public void updatePerformance(String modelName, int version, String metric, double value) {
        set(performance, PERFORMANCE, "Evaluation metric of a registered model version",
            Tags.of("model_name", modelName, "model_version", String.valueOf(version), "metric", metric), value);
    }

    public void updateProductionVersion(String modelName, Integer version) {
        set(productionVersions, PRODUCTION_VERSION, "Version currently in Production, 0 when none",
            Tags.of("model_name", modelName), version == null ? 0 : version);
    }

    public String scrape() {
        return registry.scrape();
    }

    private void set(ConcurrentHashMap<Tags, AtomicReference<Double>> holders, String name, String description,
                     Tags tags, double value) {
        holders.computeIfAbsent(tags, t -> {
            AtomicReference<Double> holder = new AtomicReference<>(value);
            Gauge.builder(name, holder, AtomicReference::get)
                .description(description)
                .tags(t)
                .strongReference(true)
                .register(registry);
            return holder;
        }).set(value);
    }
}
