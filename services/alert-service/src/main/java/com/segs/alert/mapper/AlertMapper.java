package com.segs.alert.mapper;

import com.segs.alert.dto.AlertListResponse;
import com.segs.alert.dto.AlertResponse;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.service.AlertPage;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;

/**
 * Maps alert entities to their API representation.
 */
@Component
public class AlertMapper {

    public AlertResponse toResponse(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .type(alert.getType())
                .severity(alert.getSeverity())
                .region(alert.getRegion())
                .meterId(alert.getMeterId())
                .message(alert.getMessage())
                .status(alert.getStatus())
                .acknowledged(alert.isAcknowledged())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedAt(alert.getResolvedAt())
                .metadata(alert.getMetadata() == null ? new HashMap<>() : new HashMap<>(alert.getMetadata()))
                .createdAt(alert.getCreatedAt())
                .updatedAt(alert.getUpdatedAt())
                .build();
    }

    public List<AlertResponse> toResponses(List<Alert> alerts) {
        return alerts.stream().map(this::toResponse).toList();
    }

    public AlertListResponse toListResponse(AlertPage page, int limit, long offset) {
        return AlertListResponse.builder()
                .alerts(toResponses(page.alerts()))
                .total(page.total())
                .limit(limit)
                .offset(offset)
                .build();
    }

    /**
     * Status counts over the returned page only. Acknowledged alerts are still
     * counted as active.
     */
    public AlertListResponse.StatusSummary summarize(List<Alert> alerts) {
        long active = alerts.stream().filter(a -> a.getStatus() == AlertStatus.ACTIVE).count();
        long acknowledged = alerts.stream()
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE && a.isAcknowledged())
                .count();
        long resolved = alerts.stream().filter(Alert::isResolved).count();
        return AlertListResponse.StatusSummary.builder()
                .active(active)
                .acknowledged(acknowledged)
                .resolved(resolved)
                .build();
    }
}
