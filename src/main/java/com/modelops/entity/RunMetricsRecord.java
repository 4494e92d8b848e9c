package com.modelops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "run_metrics")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunMetricsRecord {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false, length = 128)
    private String runId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "run_metric_values", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "metric_name", length = 100)
    @Column(name = "metric_value", nullable = false)
    private Map<String, Double> metrics = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
