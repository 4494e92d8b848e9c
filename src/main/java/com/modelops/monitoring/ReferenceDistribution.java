package com.modelops.monitoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-feature baseline statistics, fixed for the lifetime of a monitor.
 */
public final class ReferenceDistribution {

    private static final ReferenceDistribution EMPTY = new ReferenceDistribution(Map.of(), 0);

    private final Map<String, FeatureStats> features;
    private final int sampleSize;

    private ReferenceDistribution(Map<String, FeatureStats> features, int sampleSize) {
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.sampleSize = sampleSize;
    }

    public static ReferenceDistribution empty() {
        return EMPTY;
    }

    public static ReferenceDistribution of(Map<String, FeatureStats> features) {
        return new ReferenceDistribution(features, 0);
    }

    /**
     * Mean and sample standard deviation (n - 1) of every column in {@code rows}. Missing values
     * are skipped per column.
     */
    public static ReferenceDistribution fromSamples(List<Map<String, Double>> rows) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (Map<String, Double> row : rows) {
            row.forEach((feature, value) -> {
                if (value != null && Double.isFinite(value)) {
                    double[] acc = sums.computeIfAbsent(feature, f -> new double[2]);
                    acc[0] += value;
                    acc[1] += 1;
                }
            });
        }
        Map<String, Double> means = new LinkedHashMap<>();
        sums.forEach((feature, acc) -> means.put(feature, acc[0] / acc[1]));

        Map<String, Double> squares = new LinkedHashMap<>();
        for (Map<String, Double> row : rows) {
            row.forEach((feature, value) -> {
                if (value != null && Double.isFinite(value)) {
                    double delta = value - means.get(feature);
                    squares.merge(feature, delta * delta, Double::sum);
                }
            });
        }

        Map<String, FeatureStats> stats = new LinkedHashMap<>();
        sums.forEach((feature, acc) -> {
            long count = (long) acc[1];
            double std = count < 2 ? 0.0 : Math.sqrt(squares.getOrDefault(feature, 0.0) / (count - 1));
            stats.put(feature, new FeatureStats(means.get(feature), std, count));
        });
        return new ReferenceDistribution(stats, rows.size());
    }

    public Optional<FeatureStats> get(String feature) {
        return Optional.ofNullable(features.get(feature));
    }

    public Set<String> featureNames() {
        return features.keySet();
    }

    public Map<String, FeatureStats> asMap() {
        return features;
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public int sampleSize() {
        return sampleSize;
    }
}
