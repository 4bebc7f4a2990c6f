package com.segs.alert.service;

import com.segs.alert.cache.ConditionStateCache;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.ConditionKey;
import com.segs.alert.entity.Severity;
import com.segs.alert.exception.AlertNotFoundException;
import com.segs.alert.exception.AlertPersistenceException;
import com.segs.alert.exception.AlertValidationException;
import com.segs.alert.exception.ConnectivityException;
import com.segs.alert.exception.DuplicateAlertSuppressedException;
import com.segs.alert.kafka.AlertEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for creating and mutating alerts.
 *
 * <p>Coordinates the alert store, the condition state cache and outbound
 * publication. The store write is authoritative; cache bookkeeping and
 * publication after it are best effort.
 *
 * <p>State machine: {@code active -> active+acknowledged -> resolved} or
 * {@code active -> resolved}. Lifecycle calls on a resolved alert return it unchanged.
 * Active-condition markers are only cleared while they still point at the alert
 * being acknowledged or resolved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertLifecycleManager {

    static final int MAX_UPDATE_ATTEMPTS = 3;

    private final AlertStore alertStore;
    private final ConditionStateCache conditionStateCache;
    private final AlertEventPublisher eventPublisher;
    private final AlertProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter acknowledgedCounter;

    @PostConstruct
    public void initMetrics() {
        acknowledgedCounter = Counter.builder("segs.alerts.acknowledged")
                .description("Alerts acknowledged by an operator")
                .register(meterRegistry);
    }

    /**
     * Creates an alert unless an identical one was created within the deduplication TTL.
     *
     * @throws DuplicateAlertSuppressedException when the dedup marker is already set
     */
    public Alert createAlert(NewAlert data) {
        requireText(data.getType(), "type");
        requireText(data.getMessage(), "message");
        if (data.getSeverity() == null) {
            throw AlertValidationException.missing("severity");
        }

        ConditionKey condition = data.conditionKey();
        if (!conditionStateCache.trySetDedupMarker(condition, properties.getDeduplicationTtl())) {
            meterRegistry.counter("segs.alerts.suppressed", "type", data.getType()).increment();
            throw new DuplicateAlertSuppressedException(condition);
        }

        Alert alert;
        try {
            alert = alertStore.create(data);
        } catch (AlertPersistenceException | ConnectivityException e) {
            conditionStateCache.releaseDedupMarker(condition);
            throw e;
        }

        meterRegistry.counter("segs.alerts.created",
                "type", alert.getType(), "severity", alert.getSeverity().value()).increment();
        log.info("Alert created: id={}, type={}, severity={}, region={}, meter={}",
                alert.getId(), alert.getType(), alert.getSeverity().value(), alert.getRegion(), alert.getMeterId());

        eventPublisher.publishProcessedAlert(alert);
        return alert;
    }

    /**
     * Marks an active alert as acknowledged. A conflicting concurrent update is
     * retried against the fresh record, up to {@value #MAX_UPDATE_ATTEMPTS} attempts.
     */
    public Alert acknowledge(UUID id, String acknowledgedBy, String note) {
        requireText(acknowledgedBy, "acknowledged_by");
        for (int attempt = 1; ; attempt++) {
            Alert alert = getAlert(id);
            if (alert.isAcknowledged() || alert.isResolved()) {
                log.debug("Alert {} already acknowledged or resolved, nothing to do", id);
                return alert;
            }

            Instant now = clock.instant();
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (note != null) {
                metadata.put("acknowledgment_note", note);
            }
            metadata.put("acknowledgment_timestamp", now.toString());

            AlertUpdate update = AlertUpdate.builder()
                    .acknowledged(true)
                    .acknowledgedBy(acknowledgedBy)
                    .acknowledgedAt(now)
                    .metadata(metadata)
                    .expectedVersion(alert.getVersion())
                    .build();

            Alert updated;
            try {
                updated = alertStore.update(id, update).orElseThrow(() -> new AlertNotFoundException(id));
            } catch (OptimisticLockingFailureException e) {
                retryOrGiveUp(id, "acknowledge", attempt, e);
                continue;
            }

            conditionStateCache.clearActiveCondition(updated.conditionKey(), updated.getId());
            acknowledgedCounter.increment();
            log.info("Alert acknowledged: id={}, by={}", id, acknowledgedBy);
            eventPublisher.publishStatusUpdate(updated);
            return updated;
        }
    }

    /**
     * Resolves an alert that is not resolved yet, acknowledged or not. A conflicting
     * concurrent update is retried against the fresh record, up to
     * {@value #MAX_UPDATE_ATTEMPTS} attempts.
     */
    public Alert resolve(UUID id, String resolvedBy, String note) {
        requireText(resolvedBy, "resolved_by");
        for (int attempt = 1; ; attempt++) {
            Alert alert = getAlert(id);
            if (alert.isResolved()) {
                log.debug("Alert {} already resolved, nothing to do", id);
                return alert;
            }

            Instant now = clock.instant();
            AlertUpdate update = AlertUpdate.builder()
                    .status(AlertStatus.RESOLVED)
                    .resolvedAt(now)
                    .metadata(AlertStore.resolutionMetadata(resolvedBy, note, now))
                    .expectedVersion(alert.getVersion())
                    .build();

            Alert updated;
            try {
                updated = alertStore.update(id, update).orElseThrow(() -> new AlertNotFoundException(id));
            } catch (OptimisticLockingFailureException e) {
                retryOrGiveUp(id, "resolve", attempt, e);
                continue;
            }

            conditionStateCache.clearActiveCondition(updated.conditionKey(), updated.getId());
            meterRegistry.counter("segs.alerts.resolved", "mode", "manual").increment();
            log.info("Alert resolved: id={}, by={}", id, resolvedBy);
            eventPublisher.publishStatusUpdate(updated);
            return updated;
        }
    }

    /**
     * Resolves what can still be resolved among {@code ids}.
     *
     * @return only the alerts this call resolved
     */
    public List<Alert> bulkResolve(Collection<UUID> ids, String resolvedBy, String note) {
        if (ids == null || ids.isEmpty()) {
            throw AlertValidationException.missing("alert_ids");
        }
        requireText(resolvedBy, "resolved_by");

        List<Alert> resolved = alertStore.bulkResolve(new LinkedHashSet<>(ids), resolvedBy, clock.instant(), note);
        afterResolution(resolved, "bulk");
        log.info("Bulk resolve by {}: requested={}, resolved={}", resolvedBy, ids.size(), resolved.size());
        return resolved;
    }

    /**
     * Resolves every active alert older than {@code maxAgeHours}. Markers are cleared
     * and status updates published exactly as for a bulk resolve.
     *
     * @return number of alerts resolved
     */
    public int autoResolveOldAlerts(int maxAgeHours) {
        if (maxAgeHours <= 0) {
            throw new AlertValidationException("hours must be positive");
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofHours(maxAgeHours));

        List<Alert> resolved = alertStore.autoResolveOlderThan(cutoff, now);
        afterResolution(resolved, "auto");
        if (!resolved.isEmpty()) {
            log.info("Auto-resolved {} alerts older than {}h", resolved.size(), maxAgeHours);
        }
        return resolved.size();
    }

    public Alert getAlert(UUID id) {
        return alertStore.get(id).orElseThrow(() -> new AlertNotFoundException(id));
    }

    public AlertPage getAlerts(AlertFilter filter) {
        return alertStore.query(withPageBounds(filter));
    }

    public AlertPage getActiveAlerts(String region, Integer limit, Long offset) {
        return alertStore.query(withPageBounds(AlertFilter.builder()
                .status(AlertStatus.ACTIVE)
                .region(region)
                .limit(limit == null ? 0 : limit)
                .offset(offset == null ? 0 : offset)
                .build()));
    }

    /**
     * Resolved alerts of a region created within the last {@code hours}.
     */
    public AlertPage getAlertHistory(String region, Integer hours, Severity severity, Integer limit) {
        requireText(region, "region");
        int window = hours == null ? properties.getApi().getDefaultHistoryHours() : hours;
        if (window <= 0) {
            throw new AlertValidationException("hours must be positive");
        }
        return alertStore.query(withPageBounds(AlertFilter.builder()
                .status(AlertStatus.RESOLVED)
                .region(region)
                .severity(severity)
                .from(clock.instant().minus(Duration.ofHours(window)))
                .limit(limit == null ? 0 : limit)
                .build()));
    }

    public AlertStatistics getStatistics(String region) {
        return alertStore.statistics(region);
    }

    private void afterResolution(List<Alert> resolved, String mode) {
        for (Alert alert : resolved) {
            conditionStateCache.clearActiveCondition(alert.conditionKey(), alert.getId());
            eventPublisher.publishStatusUpdate(alert);
        }
        if (!resolved.isEmpty()) {
            meterRegistry.counter("segs.alerts.resolved", "mode", mode).increment(resolved.size());
        }
    }

    private static void retryOrGiveUp(UUID id, String action, int attempt, OptimisticLockingFailureException e) {
        if (attempt >= MAX_UPDATE_ATTEMPTS) {
            log.warn("Alert {} kept changing during {}, giving up after {} attempts", id, action, attempt);
            throw e;
        }
        log.info("Alert {} changed concurrently during {}, retrying ({}/{})", id, action, attempt, MAX_UPDATE_ATTEMPTS);
    }

    private AlertFilter withPageBounds(AlertFilter filter) {
        AlertProperties.Api api = properties.getApi();
        int limit = filter.getLimit() <= 0 ? api.getDefaultPageSize() : Math.min(filter.getLimit(), api.getMaxPageSize());
        long offset = Math.max(0, filter.getOffset());
        return filter.toBuilder().limit(limit).offset(offset).build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw AlertValidationException.missing(field);
        }
    }
}
