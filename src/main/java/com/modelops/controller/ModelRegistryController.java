package com.modelops.controller;

import com.modelops.config.RequestIdFilter;
import com.modelops.dto.AutoPromoteRequest;
import com.modelops.dto.LogMetricsRequest;
import com.modelops.dto.ModelVersionResponse;
import com.modelops.dto.PerformanceUpdateRequest;
import com.modelops.dto.PromotionResponse;
import com.modelops.dto.RegisterModelRequest;
import com.modelops.dto.RunMetricsResponse;
import com.modelops.dto.StageChangeRequest;
import com.modelops.dto.TransitionResponse;
import com.modelops.entity.ModelStage;
import com.modelops.entity.ModelVersionRecord;
import com.modelops.entity.RunMetricsRecord;
import com.modelops.service.ModelRegistryService;
import com.modelops.service.ModelSummary;
import com.modelops.service.PromotionService;
import com.modelops.service.RunMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ModelRegistryController {

    private final ModelRegistryService registryService;
    private final PromotionService     promotionService;
    private final RunMetricsService    runMetricsService;

    @PostMapping("/runs/{runId}/metrics")
    public ResponseEntity<RunMetricsResponse> logRunMetrics(
            @PathVariable String runId, @Valid @RequestBody LogMetricsRequest request,
            HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /runs/{}/metrics | metrics={} | requestId={}", runId, request.getMetrics().keySet(), requestId);
        RunMetricsRecord saved = runMetricsService.logMetrics(runId, request.getMetrics());
        return ResponseEntity.ok(RunMetricsResponse.builder()
            .runId(saved.getRunId())
            .metrics(new LinkedHashMap<>(saved.getMetrics()))
            .build());
    }

    @GetMapping("/runs/{runId}/metrics")
    public ResponseEntity<RunMetricsResponse> runMetrics(@PathVariable String runId) {
        return ResponseEntity.ok(RunMetricsResponse.builder()
            .runId(runId)
            .metrics(runMetricsService.getMetrics(runId))
            .build());
    }

    @PostMapping("/models/{name}/versions")
    public ResponseEntity<ModelVersionResponse> register(
            @PathVariable String name, @Valid @RequestBody RegisterModelRequest request,
            HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /models/{}/versions | runId={} | requestId={}", name, request.getRunId(), requestId);
        ModelVersionRecord registered = request.getMetrics() == null
            ? registryService.registerFromRun(name, request.getRunId())
            : registryService.register(name, request.getRunId(), request.getMetrics());
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/models/" + name + "/versions/" + registered.getVersion())
            .body(ModelVersionResponse.from(registered));
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelSummary>> models() {
        return ResponseEntity.ok(registryService.listModels());
    }

    @GetMapping("/models/{name}/versions")
    public ResponseEntity<List<ModelVersionResponse>> versions(@PathVariable String name) {
        return ResponseEntity.ok(registryService.listVersions(name).stream()
            .map(ModelVersionResponse::from)
            .toList());
    }

    @GetMapping("/models/{name}/versions/{version}")
    public ResponseEntity<ModelVersionResponse> version(
            @PathVariable String name, @PathVariable @Min(1) int version) {
        return ResponseEntity.ok(ModelVersionResponse.from(registryService.getVersion(name, version)));
    }

    @GetMapping("/models/{name}/stages/{stage}")
    public ResponseEntity<ModelVersionResponse> byStage(
            @PathVariable String name, @PathVariable ModelStage stage) {
        return ResponseEntity.ok(ModelVersionResponse.from(registryService.getByStage(name, stage)));
    }

    @PostMapping("/models/{name}/versions/{version}/promote")
    public ResponseEntity<TransitionResponse> promote(
            @PathVariable String name, @PathVariable @Min(1) int version,
            HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /models/{}/versions/{}/promote | requestId={}", name, version, requestId);
        return ResponseEntity.ok(TransitionResponse.from(registryService.transitionToProduction(name, version)));
    }

    @PutMapping("/models/{name}/versions/{version}/stage")
    public ResponseEntity<ModelVersionResponse> changeStage(
            @PathVariable String name, @PathVariable @Min(1) int version,
            @Valid @RequestBody StageChangeRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("PUT /models/{}/versions/{}/stage | stage={} | requestId={}",
                 name, version, request.getStage(), requestId);
        return ResponseEntity.ok(ModelVersionResponse.from(
            registryService.demote(name, version, request.getStage())));
    }

    @PostMapping("/models/{name}/versions/{version}/performance")
    public ResponseEntity<ModelVersionResponse> updatePerformance(
            @PathVariable String name, @PathVariable @Min(1) int version,
            @Valid @RequestBody PerformanceUpdateRequest request) {
        return ResponseEntity.ok(ModelVersionResponse.from(
            registryService.reportPerformance(name, version, request.getMetric(), request.getValue())));
    }

    @PostMapping("/promotions")
    public ResponseEntity<PromotionResponse> autoPromote(
            @Valid @RequestBody AutoPromoteRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /promotions | runId={} | metric={} | higherIsBetter={} | requestId={}",
                 request.getRunId(), request.getMetricName(), request.isHigherIsBetter(), requestId);
        PromotionResponse result = request.getModelName() == null || request.getModelName().isBlank()
            ? promotionService.autoPromoteIfBetter(
                request.getRunId(), request.getMetricName(), request.isHigherIsBetter())
            : promotionService.autoPromoteIfBetter(
                request.getModelName(), request.getRunId(), request.getMetricName(), request.isHigherIsBetter());
        return ResponseEntity.ok(result);
    }
}
