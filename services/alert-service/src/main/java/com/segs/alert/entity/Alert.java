package com.segs.alert.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Alert record of the system. Only the lifecycle manager writes it.
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alerts_status", columnList = "status"),
    @Index(name = "idx_alerts_type", columnList = "type"),
    @Index(name = "idx_alerts_region", columnList = "region"),
    @Index(name = "idx_alerts_meter_id", columnList = "meter_id"),
    @Index(name = "idx_alerts_acknowledged", columnList = "acknowledged"),
    @Index(name = "idx_alerts_status_created", columnList = "status, created_at")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    private UUID id;

    @Column(nullable = false, length = 50)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Column(length = 50)
    private String region;

    @Column(name = "meter_id", length = 50)
    private String meterId;

    @Column(nullable = false, columnDefinition = "text")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertStatus status;

    @Column(nullable = false)
    private boolean acknowledged;

    @Column(name = "acknowledged_by", length = 100)
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    public void acknowledge(String by, Instant at) {
        this.acknowledged = true;
        this.acknowledgedBy = by;
        this.acknowledgedAt = at;
    }

    public void resolve(Instant at) {
        this.status = AlertStatus.RESOLVED;
        this.resolvedAt = at;
    }

    public void mergeMetadata(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return;
        }
        Map<String, Object> merged = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        merged.putAll(extra);
        this.metadata = merged;
    }

    public ConditionKey conditionKey() {
        return new ConditionKey(type, region, meterId);
    }
}
