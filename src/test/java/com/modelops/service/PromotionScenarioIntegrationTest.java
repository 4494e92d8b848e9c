package com.modelops.service;

import com.modelops.dto.PromotionResponse;
import com.modelops.entity.ModelStage;
import com.modelops.entity.ModelVersionRecord;
import com.modelops.exception.ModelValidationException;
import com.modelops.repository.ModelVersionRepository;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PromotionScenarioIntegrationTest {

    @Autowired ModelRegistryService registry;
    @Autowired PromotionService promotionService;
    @Autowired ModelVersionRepository versionRepository;
    @Autowired PrometheusMeterRegistry meterRegistry;

    private String name;

    @BeforeEach
    void setUp() {
        name = "noshow-" + UUID.randomUUID();
    }

    private String registerRun(double auc) {
        String runId = "run-" + UUID.randomUUID();
        registry.register(name, runId, Map.of("auc", auc));
        return runId;
    }

    @Test
    void trainingSequence_promotesOnlyImprovements() {
        PromotionResponse first = promotionService.autoPromoteIfBetter(registerRun(0.70), "auc", true);
        assertThat(first.isPromoted()).isTrue();
        assertThat(first.getReason()).isEqualTo(PromotionDecision.Reason.BOOTSTRAP);
        assertThat(registry.getByStage(name, ModelStage.PRODUCTION).getVersion()).isEqualTo(1);

        PromotionResponse second = promotionService.autoPromoteIfBetter(registerRun(0.65), "auc", true);
        assertThat(second.isPromoted()).isFalse();
        assertThat(registry.getByStage(name, ModelStage.PRODUCTION).getVersion()).isEqualTo(1);
        assertThat(registry.getVersion(name, 2).getStage()).isEqualTo(ModelStage.NONE);

        PromotionResponse third = promotionService.autoPromoteIfBetter(registerRun(0.85), "auc", true);
        assertThat(third.isPromoted()).isTrue();
        assertThat(third.getPreviousProductionVersion()).isEqualTo(1);
        assertThat(registry.getByStage(name, ModelStage.PRODUCTION).getVersion()).isEqualTo(3);
        assertThat(registry.getVersion(name, 1).getStage()).isEqualTo(ModelStage.ARCHIVED);
        assertThat(registry.getVersion(name, 2).getStage()).isEqualTo(ModelStage.NONE);

        assertThat(meterRegistry.get("model.performance.metric")
            .tags("model_name", name, "model_version", "3", "metric", "auc")
            .gauge().value()).isEqualTo(0.85);
        assertThat(meterRegistry.get("model.production.version").tag("model_name", name).gauge().value())
            .isEqualTo(3.0);
    }

    @Test
    void repeatedPromotionOfProduction_isNotAWin() {
        String runId = registerRun(0.70);
        promotionService.autoPromoteIfBetter(runId, "auc", true);

        PromotionResponse again = promotionService.autoPromoteIfBetter(runId, "auc", true);

        assertThat(again.isPromoted()).isFalse();
        assertThat(again.getReason()).isEqualTo(PromotionDecision.Reason.ALREADY_PRODUCTION);
    }

    @Test
    void missingComparisonMetric_surfacesError() {
        promotionService.autoPromoteIfBetter(registerRun(0.70), "auc", true);
        String runId = "run-" + UUID.randomUUID();
        registry.register(name, runId, Map.of("f1", 0.9));

        assertThatThrownBy(() -> promotionService.autoPromoteIfBetter(runId, "auc", true))
            .isInstanceOf(ModelValidationException.class)
            .hasMessageContaining("auc");
        assertThat(registry.getByStage(name, ModelStage.PRODUCTION).getVersion()).isEqualTo(1);
    }

    @Test
    void concurrentCandidates_bestOneEndsInProduction() throws Exception {
        List<String> runs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            runs.add(registerRun(0.60 + i * 0.05));
        }
        ExecutorService pool = Executors.newFixedThreadPool(runs.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PromotionResponse>> futures = new ArrayList<>();
            for (String runId : runs) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return promotionService.autoPromoteIfBetter(runId, "auc", true);
                }));
            }
            start.countDown();
            for (Future<PromotionResponse> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ModelVersionRecord> production = versionRepository.findByNameAndStage(name, ModelStage.PRODUCTION);
        assertThat(production).hasSize(1);
        assertThat(production.get(0).getMetrics().get("auc")).isCloseTo(0.85, within(1e-9));
    }
}
