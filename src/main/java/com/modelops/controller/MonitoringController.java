package com.modelops.controller;

import com.modelops.config.RequestIdFilter;
import com.modelops.dto.DriftReportResponse;
import com.modelops.dto.RecordPredictionRequest;
import com.modelops.monitoring.DriftAssessment;
import com.modelops.monitoring.DriftMonitor;
import com.modelops.monitoring.DriftReportService;
import com.modelops.monitoring.ReportFormat;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final DriftMonitor       driftMonitor;
    private final DriftReportService reportService;

    @PostMapping("/predictions")
    public ResponseEntity<Void> recordPrediction(
            @Valid @RequestBody RecordPredictionRequest request, HttpServletRequest httpRequest) {
        driftMonitor.record(request.getFeatures(), request.getPrediction(),
                            request.getModelVersion(), request.getLatencySeconds());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .header(RequestIdFilter.HEADER, RequestIdFilter.requestId(httpRequest))
            .build();
    }

    @GetMapping("/drift")
    public ResponseEntity<DriftAssessment> drift() {
        return ResponseEntity.ok(driftMonitor.assess());
    }

    @PostMapping("/drift/report")
    public ResponseEntity<DriftReportResponse> generateReport(
            @RequestParam(required = false) ReportFormat format, HttpServletRequest httpRequest) {
        ReportFormat resolved = format != null ? format : ReportFormat.HTML;
        log.info("POST /drift/report | format={} | requestId={}", resolved, RequestIdFilter.requestId(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(reportService.generateReport(resolved));
    }
}
