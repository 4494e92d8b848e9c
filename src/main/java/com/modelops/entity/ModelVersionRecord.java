package com.modelops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "model_versions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_model_version", columnNames = {"model_name", "version_number"}),
        @UniqueConstraint(name = "uk_model_run", columnNames = {"model_name", "run_id"}),
    },
    indexes = {
        @Index(name = "idx_version_stage", columnList = "model_name, stage"),
        @Index(name = "idx_version_run",   columnList = "run_id"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, updatable = false, length = 128)
    private String name;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int version;

    @Column(name = "run_id", nullable = false, updatable = false, length = 128)
    private String runId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_metrics", joinColumns = @JoinColumn(name = "model_version_id"))
    @MapKeyColumn(name = "metric_name", length = 100)
    @Column(name = "metric_value", nullable = false)
    private Map<String, Double> metrics = new LinkedHashMap<>();

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ModelStage stage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Setter
    @Column(name = "updated_at")
    private Instant updatedAt;

    public Double metric(String metricName) {
        return metrics.get(metricName);
    }
}
