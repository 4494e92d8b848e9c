package com.modelops.controller;

import com.modelops.dto.AutoPromoteRequest;
import com.modelops.dto.LogMetricsRequest;
import com.modelops.dto.RegisterModelRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ModelRegistryControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    private String name;

    @BeforeEach
    void setUp() {
        name = "noshow-" + UUID.randomUUID();
    }

    private ResponseEntity<Map> register(String runId, double auc) {
        RegisterModelRequest request = RegisterModelRequest.builder()
            .runId(runId).metrics(Map.of("auc", auc)).build();
        return restTemplate.postForEntity("/api/v1/models/" + name + "/versions", request, Map.class);
    }

    private HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    @Test
    void register_returnsCreatedVersion() {
        ResponseEntity<Map> resp = register("run-a", 0.70);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody()).containsEntry("version", 1).containsEntry("stage", "None");
        assertThat(resp.getHeaders().getLocation()).hasToString("/api/v1/models/" + name + "/versions/1");
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
    }

    @Test
    void register_echoesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        HttpEntity<RegisterModelRequest> entity = new HttpEntity<>(
            RegisterModelRequest.builder().runId("run-b").metrics(Map.of("auc", 0.7)).build(), headers);
        ResponseEntity<Map> resp = restTemplate.exchange(
            "/api/v1/models/" + name + "/versions", HttpMethod.POST, entity, Map.class);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
    }

    @Test
    void register_withoutMetrics_usesRunSnapshot() {
        String runId = "run-" + UUID.randomUUID();
        ResponseEntity<Map> logged = restTemplate.postForEntity("/api/v1/runs/" + runId + "/metrics",
            LogMetricsRequest.builder().metrics(Map.of("auc", 0.81)).build(), Map.class);
        assertThat(logged.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/" + name + "/versions",
            RegisterModelRequest.builder().runId(runId).build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat((Map<String, Object>) resp.getBody().get("metrics")).containsEntry("auc", 0.81);
    }

    @Test
    void register_blankRunId_returns422WithFieldErrors() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/" + name + "/versions",
            json("{\"runId\":\"\",\"metrics\":{\"auc\":0.7}}"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void register_duplicateRun_returns422() {
        register("run-dup", 0.7);
        ResponseEntity<Map> resp = register("run-dup", 0.8);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("code", "MODEL_VALIDATION_ERROR");
    }

    @Test
    void register_oversizedMetricName_returns422NotConflict() {
        String metric = "m".repeat(150);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/" + name + "/versions",
            json("{\"runId\":\"run-long\",\"metrics\":{\"" + metric + "\":0.7}}"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("code", "MODEL_VALIDATION_ERROR");
    }

    @Test
    void logRunMetrics_oversizedMetricName_returns422() {
        String metric = "m".repeat(150);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/runs/run-" + UUID.randomUUID() + "/metrics",
            json("{\"metrics\":{\"" + metric + "\":0.7}}"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("code", "MODEL_VALIDATION_ERROR");
    }

    @Test
    void malformedBody_returns400() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/" + name + "/versions",
            json("{not json"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void unknownModel_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/models/" + name + "/stages/Production", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsEntry("code", "MODEL_NOT_FOUND");
        assertThat(resp.getBody()).containsKey("requestId");
    }

    @Test
    void unknownStage_returns422() {
        register("run-s", 0.7);
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/models/" + name + "/stages/Staging", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void nonNumericVersion_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/models/" + name + "/versions/latest", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void promoteThenQueryByStage() {
        register("run-1", 0.70);
        register("run-2", 0.85);
        restTemplate.postForEntity("/api/v1/models/" + name + "/versions/1/promote", null, Map.class);

        ResponseEntity<Map> resp = restTemplate.postForEntity(
            "/api/v1/models/" + name + "/versions/2/promote", null, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((Map<String, Object>) resp.getBody().get("demoted")).containsEntry("stage", "Archived");
        ResponseEntity<Map> production = restTemplate.getForEntity(
            "/api/v1/models/" + name + "/stages/production", Map.class);
        assertThat(production.getBody()).containsEntry("version", 2);
    }

    @Test
    void changeStage_archivesVersion() {
        register("run-1", 0.70);
        restTemplate.postForEntity("/api/v1/models/" + name + "/versions/1/promote", null, Map.class);

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/models/" + name + "/versions/1/stage",
            HttpMethod.PUT, json("{\"stage\":\"Archived\"}"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("stage", "Archived");
        assertThat(restTemplate.getForEntity("/api/v1/models/" + name + "/stages/Production", Map.class)
            .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void autoPromote_scenarioOverHttp() {
        register("run-1", 0.70);
        register("run-2", 0.65);

        ResponseEntity<Map> first = restTemplate.postForEntity("/api/v1/promotions",
            AutoPromoteRequest.builder().runId("run-1").metricName("auc").higherIsBetter(true)
                .modelName(name).build(), Map.class);
        ResponseEntity<Map> second = restTemplate.postForEntity("/api/v1/promotions",
            AutoPromoteRequest.builder().runId("run-2").metricName("auc").higherIsBetter(true)
                .modelName(name).build(), Map.class);

        assertThat(first.getBody()).containsEntry("promoted", true).containsEntry("reason", "BOOTSTRAP");
        assertThat(second.getBody()).containsEntry("promoted", false).containsEntry("reason", "NOT_BETTER");
    }

    @Test
    void listEndpoints() {
        register("run-1", 0.70);
        register("run-2", 0.75);

        ResponseEntity<List> versions = restTemplate.getForEntity("/api/v1/models/" + name + "/versions", List.class);
        assertThat(versions.getBody()).hasSize(2);

        ResponseEntity<List> models = restTemplate.getForEntity("/api/v1/models", List.class);
        assertThat(models.getBody()).anySatisfy(m -> assertThat((Map<String, Object>) m).containsEntry("name", name));
    }

    @Test
    void performanceUpdate_appearsInScrape() {
        register("run-1", 0.70);
        ResponseEntity<Map> resp = restTemplate.postForEntity(
            "/api/v1/models/" + name + "/versions/1/performance",
            json("{\"metric\":\"auc\",\"value\":0.91}"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);

        String scrape = restTemplate.getForObject("/metrics", String.class);
        assertThat(scrape).contains("model_performance_metric").contains(name);
    }
}
