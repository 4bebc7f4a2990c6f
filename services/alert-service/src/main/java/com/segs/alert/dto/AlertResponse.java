package com.segs.alert.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Alert as exposed over HTTP and on the processed-alerts topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertResponse {

    private UUID id;
    private String type;
    private Severity severity;
    private String region;
    private String meterId;
    private String message;
    private AlertStatus status;
    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;
}
