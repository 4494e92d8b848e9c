package com.modelops.controller;

import com.modelops.metrics.ModelMetricsExporter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Prometheus scrape target. */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";

    private final ModelMetricsExporter metricsExporter;

    @GetMapping(value = "/metrics", produces = PROMETHEUS_TEXT)
    public ResponseEntity<String> scrape() {
        return ResponseEntity.ok(metricsExporter.scrape());
    }
}
