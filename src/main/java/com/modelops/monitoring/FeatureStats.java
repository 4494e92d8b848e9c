package com.modelops.monitoring;

public record FeatureStats(double mean, double std, long count) {}
