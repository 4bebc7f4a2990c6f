package com.segs.alert.controller;

import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.dto.AlertListResponse;
import com.segs.alert.dto.AlertResponse;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.Severity;
import com.segs.alert.exception.MeterAccessDeniedException;
import com.segs.alert.mapper.AlertMapper;
import com.segs.alert.service.AlertFilter;
import com.segs.alert.service.AlertLifecycleManager;
import com.segs.alert.service.AlertPage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

/**
 * Alerts of a single meter. The caller's meter id is trusted as supplied by the gateway.
 */
@Slf4j
@RestController
@RequestMapping("/user/alerts")
@RequiredArgsConstructor
@Validated
@Tag(name = "User Alerts", description = "Read-only alert access scoped to one meter")
public class UserAlertController {

    private final AlertLifecycleManager lifecycleManager;
    private final AlertMapper alertMapper;
    private final AlertProperties properties;

    @GetMapping
    @Operation(summary = "List the meter's alerts", description = "Includes a status summary of the returned page")
    public ResponseEntity<AlertListResponse> getAlerts(
            @RequestParam(name = "meter_id") @NotBlank String meterId,
            @RequestParam(required = false) AlertStatus status,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) @Min(1) Integer limit,
            @RequestParam(required = false) @Min(0) Long offset) {

        log.debug("Fetching alerts for meter {}", meterId);
        AlertPage page = lifecycleManager.getAlerts(AlertFilter.builder()
                .meterId(meterId)
                .status(status)
                .severity(severity)
                .type(type)
                .from(from)
                .to(to)
                .limit(limit == null ? 0 : limit)
                .offset(offset == null ? 0 : offset)
                .build());

        int effectiveLimit = limit == null ? properties.getApi().getDefaultPageSize()
                : Math.min(limit, properties.getApi().getMaxPageSize());
        AlertListResponse response = alertMapper.toListResponse(page, effectiveLimit, offset == null ? 0 : offset);
        response.setSummary(alertMapper.summarize(page.alerts()));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get one of the meter's alerts", description = "403 when the alert belongs to another meter")
    public ResponseEntity<AlertResponse> getAlert(
            @PathVariable UUID id,
            @RequestParam(name = "meter_id") @NotBlank String meterId) {
        Alert alert = lifecycleManager.getAlert(id);
        if (!meterId.equals(alert.getMeterId())) {
            throw new MeterAccessDeniedException(id, meterId);
        }
        return ResponseEntity.ok(alertMapper.toResponse(alert));
    }
}
