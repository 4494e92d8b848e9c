package com.modelops.monitoring;

import com.modelops.exception.ModelValidationException;
import com.modelops.metrics.ModelMetricsExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares live input features against the reference distribution.
 *
 * <p>{@link #record} only appends to a lock-free ring and bumps meters, so inference threads never
 * wait on {@link #computeDrift}, which works on a copy of the ring.
 */
@Slf4j
@Component
public class DriftMonitor {

    private final ModelMetricsExporter metricsExporter;
    private final ReferenceDistribution reference;
    private final DriftBuffer buffer;
    private final double threshold;
    private final String positiveLabel;
    private final String negativeLabel;
    private final Set<String> publishedFeatures = ConcurrentHashMap.newKeySet();

    public DriftMonitor(ReferenceDistributionLoader referenceLoader,
                        ModelMetricsExporter metricsExporter,
                        @Value("${monitoring.drift.buffer-capacity:1000}") int bufferCapacity,
                        @Value("${monitoring.drift.threshold:0.1}") double threshold,
                        @Value("${monitoring.outcome.positive-label:no_show}") String positiveLabel,
                        @Value("${monitoring.outcome.negative-label:show}") String negativeLabel) {
        this.metricsExporter = metricsExporter;
        this.reference = referenceLoader.load();
        this.buffer = new DriftBuffer(bufferCapacity);
        this.threshold = threshold;
        this.positiveLabel = positiveLabel;
        this.negativeLabel = negativeLabel;
    }

    public void record(Map<String, ?> features, int prediction, String modelVersion, double latencySeconds) {
        if (prediction != 0 && prediction != 1) {
            throw new ModelValidationException("Prediction must be 0 or 1, got " + prediction);
        }
        if (!Double.isFinite(latencySeconds) || latencySeconds < 0) {
            throw new ModelValidationException("Latency must be a non-negative number of seconds, got " + latencySeconds);
        }
        String version = modelVersion == null || modelVersion.isBlank() ? "unknown" : modelVersion;
        buffer.append(numericFeatures(features));
        metricsExporter.recordPrediction(version, prediction == 1 ? positiveLabel : negativeLabel, latencySeconds);
        log.debug("Prediction recorded | version={} | prediction={} | latency={}", version, prediction, latencySeconds);
    }

    /**
     * Drift score per feature, {@code min(|mean(live) - ref.mean| / ref.std, 1)}. Empty when no
     * traffic has been recorded or no reference was loaded.
     */
    public Map<String, Double> computeDrift() {
        return assess().scores();
    }

    public DriftAssessment assess() {
        List<Map<String, Double>> snapshot = buffer.snapshot();
        List<DriftAssessment.FeatureDrift> features = new ArrayList<>();

        if (!snapshot.isEmpty() && !reference.isEmpty()) {
            Map<String, double[]> sums = new HashMap<>();
            for (Map<String, Double> row : snapshot) {
                row.forEach((feature, value) -> {
                    double[] acc = sums.computeIfAbsent(feature, f -> new double[2]);
                    acc[0] += value;
                    acc[1] += 1;
                });
            }
            reference.asMap().forEach((feature, ref) -> {
                double[] acc = sums.get(feature);
                if (acc == null) {
                    return;
                }
                double currentMean = acc[0] / acc[1];
                double score = score(currentMean, ref);
                features.add(DriftAssessment.FeatureDrift.builder()
                    .feature(feature)
                    .currentMean(currentMean)
                    .referenceMean(ref.mean())
                    .referenceStd(ref.std())
                    .driftScore(score)
                    .highDrift(score > threshold)
                    .build());
            });
        }
        publishScores(features);

        return DriftAssessment.builder()
            .computedAt(Instant.now())
            .sampleSize(snapshot.size())
            .bufferCapacity(buffer.capacity())
            .threshold(threshold)
            .referenceLoaded(!reference.isEmpty())
            .features(Collections.unmodifiableList(features))
            .build();
    }

    public double getThreshold() {
        return threshold;
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public long totalRecorded() {
        return buffer.totalAppended();
    }

    public ReferenceDistribution getReference() {
        return reference;
    }

    // A feature that leaves the window is reported as 0 rather than keeping its last score.
    private synchronized void publishScores(List<DriftAssessment.FeatureDrift> features) {
        Set<String> current = new HashSet<>();
        for (DriftAssessment.FeatureDrift drift : features) {
            metricsExporter.updateDriftScore(drift.getFeature(), drift.getDriftScore());
            current.add(drift.getFeature());
        }
        for (String stale : publishedFeatures) {
            if (!current.contains(stale)) {
                metricsExporter.updateDriftScore(stale, 0.0);
            }
        }
        publishedFeatures.retainAll(current);
        publishedFeatures.addAll(current);
    }

    static double score(double currentMean, FeatureStats ref) {
        if (ref.std() <= 0.0) {
            return 0.0;
        }
        return Math.min(Math.abs(currentMean - ref.mean()) / ref.std(), 1.0);
    }

    private static Map<String, Double> numericFeatures(Map<String, ?> features) {
        if (features == null || features.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> numeric = new LinkedHashMap<>();
        features.forEach((name, value) -> {
            if (name != null && value instanceof Number number) {
                double d = number.doubleValue();
                if (Double.isFinite(d)) {
                    numeric.put(name, d);
                }
            }
        });
        return Collections.unmodifiableMap(numeric);
    }
}
