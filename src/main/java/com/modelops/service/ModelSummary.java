package com.modelops.service;

import java.time.Instant;

public record ModelSummary(
    String name,
    long versionCount,
    int latestVersion,
    Integer productionVersion,
    Instant updatedAt
) {}
