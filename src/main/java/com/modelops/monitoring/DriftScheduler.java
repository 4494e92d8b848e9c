package com.modelops.monitoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keeps the drift gauges current between scrapes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitoring.drift.schedule.enabled", havingValue = "true")
public class DriftScheduler {

    private final DriftMonitor driftMonitor;

    @Scheduled(fixedDelayString = "${monitoring.drift.refresh-interval-ms:60000}",
               initialDelayString = "${monitoring.drift.refresh-interval-ms:60000}")
    public void refresh() {
        DriftAssessment assessment = driftMonitor.assess();
        List<String> flagged = assessment.highDriftFeatures().stream()
            .map(DriftAssessment.FeatureDrift::getFeature)
            .toList();
        if (flagged.isEmpty()) {
            log.debug("Drift refreshed | samples={} | features={}", assessment.getSampleSize(), assessment.getFeatures().size());
        } else {
            log.warn("High drift detected | samples={} | threshold={} | features={}",
                     assessment.getSampleSize(), assessment.getThreshold(), flagged);
        }
    }
}
