package com.segs.alert.controller;

import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.dto.AcknowledgeAlertRequest;
import com.segs.alert.dto.AlertListResponse;
import com.segs.alert.dto.AlertResponse;
import com.segs.alert.dto.AutoResolveResponse;
import com.segs.alert.dto.BulkResolveRequest;
import com.segs.alert.dto.BulkResolveResponse;
import com.segs.alert.dto.ResolveAlertRequest;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.Severity;
import com.segs.alert.mapper.AlertMapper;
import com.segs.alert.service.AlertFilter;
import com.segs.alert.service.AlertLifecycleManager;
import com.segs.alert.service.AlertPage;
import com.segs.alert.service.AlertStatistics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operator view of all alerts and their lifecycle actions.
 */
@Slf4j
@RestController
@RequestMapping("/operator/alerts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Operator Alerts", description = "Alert queries and lifecycle actions for grid operators")
public class OperatorAlertController {

    private final AlertLifecycleManager lifecycleManager;
    private final AlertMapper alertMapper;
    private final AlertProperties properties;

    @GetMapping
    @Operation(summary = "List alerts", description = "Filtered, paginated, newest first")
    public ResponseEntity<AlertListResponse> getAlerts(
            @RequestParam(required = false) AlertStatus status,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String region,
            @RequestParam(name = "meter_id", required = false) String meterId,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) @Min(1) Integer limit,
            @RequestParam(required = false) @Min(0) Long offset) {

        AlertFilter filter = AlertFilter.builder()
                .status(status)
                .type(type)
                .severity(severity)
                .region(region)
                .meterId(meterId)
                .acknowledged(acknowledged)
                .from(from)
                .to(to)
                .limit(limit == null ? 0 : limit)
                .offset(offset == null ? 0 : offset)
                .build();
        return ResponseEntity.ok(page(lifecycleManager.getAlerts(filter), limit, offset));
    }

    @GetMapping("/active")
    @Operation(summary = "List active alerts")
    public ResponseEntity<AlertListResponse> getActiveAlerts(
            @RequestParam(required = false) String region,
            @RequestParam(required = false) @Min(1) Integer limit,
            @RequestParam(required = false) @Min(0) Long offset) {
        return ResponseEntity.ok(page(lifecycleManager.getActiveAlerts(region, limit, offset), limit, offset));
    }

    @GetMapping("/history/{region}")
    @Operation(summary = "Resolved alerts of a region", description = "Created within the last `hours` (default 24)")
    public ResponseEntity<AlertListResponse> getAlertHistory(
            @PathVariable String region,
            @RequestParam(required = false) @Min(1) Integer hours,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) @Min(1) Integer limit) {
        return ResponseEntity.ok(page(lifecycleManager.getAlertHistory(region, hours, severity, limit), limit, 0L));
    }

    @GetMapping("/stats")
    @Operation(summary = "Alert statistics", description = "Optionally restricted to one region")
    public ResponseEntity<AlertStatistics> getStatistics(@RequestParam(required = false) String region) {
        return ResponseEntity.ok(lifecycleManager.getStatistics(region));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an alert")
    public ResponseEntity<AlertResponse> getAlert(@PathVariable UUID id) {
        return ResponseEntity.ok(alertMapper.toResponse(lifecycleManager.getAlert(id)));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge an alert", description = "Idempotent; clears the active-condition marker")
    public ResponseEntity<AlertResponse> acknowledge(
            @PathVariable UUID id,
            @Valid @RequestBody AcknowledgeAlertRequest request) {
        log.info("Acknowledge requested: alert={}, by={}", id, request.getAcknowledgedBy());
        Alert alert = lifecycleManager.acknowledge(id, request.getAcknowledgedBy(), request.getNotes());
        return ResponseEntity.ok(alertMapper.toResponse(alert));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve an alert", description = "Idempotent; a resolved alert is returned unchanged")
    public ResponseEntity<AlertResponse> resolve(
            @PathVariable UUID id,
            @Valid @RequestBody ResolveAlertRequest request) {
        log.info("Resolve requested: alert={}, by={}", id, request.getResolvedBy());
        Alert alert = lifecycleManager.resolve(id, request.getResolvedBy(), request.getResolution());
        return ResponseEntity.ok(alertMapper.toResponse(alert));
    }

    @PostMapping("/bulk-resolve")
    @Operation(summary = "Resolve several alerts", description = "Missing or already resolved ids are skipped")
    public ResponseEntity<BulkResolveResponse> bulkResolve(@Valid @RequestBody BulkResolveRequest request) {
        log.info("Bulk resolve requested: {} alerts, by={}", request.getAlertIds().size(), request.getResolvedBy());
        List<Alert> resolved = lifecycleManager.bulkResolve(
                request.getAlertIds(), request.getResolvedBy(), request.getResolution());
        return ResponseEntity.ok(BulkResolveResponse.builder()
                .resolvedCount(resolved.size())
                .alerts(alertMapper.toResponses(resolved))
                .build());
    }

    @PostMapping("/auto-resolve")
    @Operation(summary = "Resolve stale active alerts", description = "Active alerts older than `hours` (default 48)")
    public ResponseEntity<AutoResolveResponse> autoResolve(@RequestParam(required = false) @Min(1) Integer hours) {
        int maxAge = hours == null ? properties.getMaintenance().getAutoResolveMaxAgeHours() : hours;
        log.info("Auto-resolve requested: maxAgeHours={}", maxAge);
        int resolved = lifecycleManager.autoResolveOldAlerts(maxAge);
        return ResponseEntity.ok(AutoResolveResponse.builder()
                .resolvedCount(resolved)
                .maxAgeHours(maxAge)
                .build());
    }

    private AlertListResponse page(AlertPage page, Integer limit, Long offset) {
        int effectiveLimit = limit == null ? properties.getApi().getDefaultPageSize()
                : Math.min(limit, properties.getApi().getMaxPageSize());
        return alertMapper.toListResponse(page, effectiveLimit, offset == null ? 0 : offset);
    }
}
