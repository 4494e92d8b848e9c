package com.modelops.monitoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelops.dto.DriftReportResponse;
import com.modelops.exception.ReportGenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the current drift assessment into a static report file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftReportService {

    private static final DateTimeFormatter GENERATED_AT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final DriftMonitor driftMonitor;
    private final ObjectMapper objectMapper;

    @Value("${monitoring.report.output-dir:reports}")
    private String outputDir;

    public DriftReportResponse generateReport(ReportFormat format) {
        DriftAssessment assessment = driftMonitor.assess();
        Instant generatedAt = Instant.now();
        Path target = Path.of(outputDir).resolve("drift_report." + format.extension());
        String content = format == ReportFormat.JSON ? renderJson(assessment) : renderHtml(assessment, generatedAt);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ReportGenerationException("Could not write drift report to " + target, ex);
        }
        int flagged = assessment.highDriftFeatures().size();
        log.info("Drift report generated | path={} | features={} | highDrift={}",
                 target, assessment.getFeatures().size(), flagged);
        return DriftReportResponse.builder()
            .reportPath(target.toString())
            .format(format)
            .generatedAt(generatedAt)
            .highDriftCount(flagged)
            .assessment(assessment)
            .build();
    }

    String renderHtml(DriftAssessment assessment, Instant generatedAt) {
        StringBuilder html = new StringBuilder(1024)
            .append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
            .append("<title>Drift Detection Report</title>\n<style>\n")
            .append("body { font-family: Arial, sans-serif; margin: 20px; }\n")
            .append("h1 { color: #333; }\n")
            .append(".metric { padding: 10px; margin: 10px 0; background: #f5f5f5; border-radius: 5px; }\n")
            .append(".high-drift { background: #ffcccc; }\n")
            .append(".low-drift { background: #ccffcc; }\n")
            .append("</style>\n</head>\n<body>\n")
            .append("<h1>Model Drift Detection Report</h1>\n")
            .append("<p>Generated: ").append(GENERATED_AT.format(generatedAt)).append("</p>\n")
            .append("<p>Samples: ").append(assessment.getSampleSize())
            .append(" / ").append(assessment.getBufferCapacity())
            .append(" &middot; Threshold: ").append(format(assessment.getThreshold())).append("</p>\n")
            .append("<h2>Drift Scores</h2>\n");

        if (assessment.getFeatures().isEmpty()) {
            html.append("<p>No drift data: ")
                .append(assessment.isReferenceLoaded() ? "no live traffic recorded yet." : "no reference distribution loaded.")
                .append("</p>\n");
        }
        for (DriftAssessment.FeatureDrift feature : assessment.getFeatures()) {
            html.append("<div class=\"metric ").append(feature.isHighDrift() ? "high-drift" : "low-drift").append("\">")
                .append("<strong>").append(HtmlUtils.htmlEscape(feature.getFeature())).append("</strong>: ")
                .append(format(feature.getDriftScore()))
                .append(feature.isHighDrift() ? " HIGH DRIFT" : " OK")
                .append(" <small>(live mean ").append(format(feature.getCurrentMean()))
                .append(", reference ").append(format(feature.getReferenceMean()))
                .append(" &plusmn; ").append(format(feature.getReferenceStd())).append(")</small>")
                .append("</div>\n");
        }
        return html.append("</body>\n</html>\n").toString();
    }

    private String renderJson(DriftAssessment assessment) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(assessment);
        } catch (JsonProcessingException ex) {
            throw new ReportGenerationException("Could not serialise drift report", ex);
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
