package com.modelops.monitoring;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class DriftAssessment {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant computedAt;
    int sampleSize;
    int bufferCapacity;
    double threshold;
    boolean referenceLoaded;
    List<FeatureDrift> features;

    public Map<String, Double> scores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        features.forEach(f -> scores.put(f.getFeature(), f.getDriftScore()));
        return scores;
    }

    public List<FeatureDrift> highDriftFeatures() {
        return features.stream().filter(FeatureDrift::isHighDrift).toList();
    }

    @Value
    @Builder
    public static class FeatureDrift {
        String feature;
        double currentMean;
        double referenceMean;
        double referenceStd;
        double driftScore;
        boolean highDrift;
    }
}
