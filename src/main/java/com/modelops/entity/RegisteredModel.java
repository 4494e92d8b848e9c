package com.modelops.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One row per model name. Every registration and stage change of the name updates this row,
 * so its {@code @Version} counter orders all writers of the name.
 */
@Entity
@Table(name = "registered_models")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisteredModel {

    @Id
    @Column(name = "model_name", nullable = false, updatable = false, length = 128)
    private String name;

    @Column(name = "latest_version", nullable = false)
    private int latestVersion;

    @Column(name = "production_version")
    private Integer productionVersion;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "lock_version", nullable = false)
    private Long lockVersion;
}
