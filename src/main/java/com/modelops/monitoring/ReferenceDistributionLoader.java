package com.modelops.monitoring;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the reference distribution from the head of a historical CSV sample. Only columns whose
 * non-blank values are all numeric become features.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDistributionLoader {

    private final ResourceLoader resourceLoader;
    private final CsvMapper csvMapper = new CsvMapper();

    @Value("${monitoring.reference.path:classpath:reference/noshow_reference.csv}")
    private String referencePath;

    @Value("${monitoring.reference.sample-size:1000}")
    private int sampleSize;

    public ReferenceDistribution load() {
        return load(referencePath);
    }

    public ReferenceDistribution load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Reference data not found, drift scoring disabled | path={}", location);
            return ReferenceDistribution.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            ReferenceDistribution reference = parse(in);
            log.info("Reference distribution loaded | path={} | rows={} | features={}",
                     location, reference.sampleSize(), reference.featureNames());
            return reference;
        } catch (IOException | RuntimeException ex) {
            log.warn("Reference data unreadable, drift scoring disabled | path={} | cause={}",
                     location, ex.getMessage());
            return ReferenceDistribution.empty();
        }
    }

    ReferenceDistribution parse(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        Set<String> nonNumeric = new HashSet<>();
        Set<String> populated = new HashSet<>();

        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (it.hasNext() && rows.size() < Math.max(1, sampleSize)) {
                Map<String, String> row = it.next();
                rows.add(row);
                row.forEach((column, raw) -> {
                    columns.add(column);
                    if (raw == null || raw.isBlank()) {
                        return;
                    }
                    populated.add(column);
                    if (parse(raw) == null) {
                        nonNumeric.add(column);
                    }
                });
            }
        }

        List<String> numeric = columns.stream()
            .filter(populated::contains)
            .filter(c -> !nonNumeric.contains(c))
            .toList();
        List<Map<String, Double>> samples = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String column : numeric) {
                Double value = parse(row.get(column));
                if (value != null) {
                    values.put(column, value);
                }
            }
            samples.add(values);
        }
        return ReferenceDistribution.fromSamples(samples);
    }

    private static Double parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
