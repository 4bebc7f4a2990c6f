package com.segs.alert.kafka;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.segs.alert.entity.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after every acknowledge or resolve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertStatusUpdateEvent {

    private UUID alertId;
    private AlertStatus status;
    private Instant timestamp;
    private StatusMetadata metadata;
    private String source;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StatusMetadata {
        private boolean acknowledged;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
        private Instant resolvedAt;
        private Instant updatedAt;
    }
}
