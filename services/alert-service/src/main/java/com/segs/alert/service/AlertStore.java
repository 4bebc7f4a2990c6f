package com.segs.alert.service;

import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.exception.AlertPersistenceException;
import com.segs.alert.exception.AlertServiceException;
import com.segs.alert.exception.ConnectivityException;
import com.segs.alert.repository.AlertRepository;
import com.segs.alert.repository.AlertSpecifications;
import com.segs.alert.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage of alert records.
 *
 * <p>Only {@link AlertLifecycleManager} calls this class. Storage failures surface as
 * {@link AlertPersistenceException}, or {@link ConnectivityException} when the database
 * cannot be reached; optimistic locking conflicts are passed through
 * untouched so the caller can re-read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertStore {

    static final String AUTO_RESOLVED_BY = "system-auto-resolve";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final AlertRepository alertRepository;
    private final Clock clock;

    @Transactional
    public Alert create(NewAlert data) {
        Instant now = clock.instant();
        Alert alert = Alert.builder()
                .id(UUID.randomUUID())
                .type(data.getType())
                .severity(data.getSeverity())
                .region(data.getRegion())
                .meterId(data.getMeterId())
                .message(data.getMessage())
                .status(AlertStatus.ACTIVE)
                .acknowledged(false)
                .metadata(data.getMetadata() == null ? new HashMap<>() : new HashMap<>(data.getMetadata()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            Alert saved = alertRepository.saveAndFlush(alert);
            log.debug("Alert stored: id={}, type={}, region={}, meter={}",
                    saved.getId(), saved.getType(), saved.getRegion(), saved.getMeterId());
            return saved;
        } catch (DataAccessException e) {
            throw storeFailure("Failed to create alert of type " + data.getType(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Alert> get(UUID id) {
        try {
            return alertRepository.findById(id);
        } catch (DataAccessException e) {
            throw storeFailure("Failed to read alert " + id, e);
        }
    }

    @Transactional
    public Optional<Alert> update(UUID id, AlertUpdate update) {
        try {
            Optional<Alert> found = alertRepository.findById(id);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            Alert alert = found.get();
            if (update.getExpectedVersion() != null && !update.getExpectedVersion().equals(alert.getVersion())) {
                throw new ObjectOptimisticLockingFailureException(Alert.class, id);
            }
            apply(alert, update);
            alert.setUpdatedAt(clock.instant());
            return Optional.of(alertRepository.saveAndFlush(alert));
        } catch (OptimisticLockingFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            throw storeFailure("Failed to update alert " + id, e);
        }
    }

    @Transactional(readOnly = true)
    public AlertPage query(AlertFilter filter) {
        try {
            Page<Alert> page = alertRepository.findAll(AlertSpecifications.matching(filter),
                    new OffsetPageRequest(filter.getOffset(), filter.getLimit(), NEWEST_FIRST));
            return new AlertPage(page.getContent(), page.getTotalElements());
        } catch (DataAccessException e) {
            throw storeFailure("Failed to query alerts", e);
        }
    }

    /**
     * Resolves every listed alert that is not yet resolved, in one transaction.
     * Unknown and already-resolved ids are skipped.
     *
     * @return the alerts this call resolved
     */
    @Transactional
    public List<Alert> bulkResolve(Collection<UUID> ids, String resolvedBy, Instant resolvedAt, String note) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        try {
            List<Alert> resolvable = alertRepository.lockUnresolvedByIds(ids, AlertStatus.RESOLVED);
            Map<String, Object> resolutionMetadata = resolutionMetadata(resolvedBy, note, resolvedAt);
            for (Alert alert : resolvable) {
                alert.resolve(resolvedAt);
                alert.mergeMetadata(resolutionMetadata);
                alert.setUpdatedAt(resolvedAt);
            }
            List<Alert> saved = alertRepository.saveAllAndFlush(resolvable);
            log.info("Bulk resolve: requested={}, resolved={}", ids.size(), saved.size());
            return saved;
        } catch (DataAccessException e) {
            throw storeFailure("Failed to bulk resolve " + ids.size() + " alerts", e);
        }
    }

    /**
     * Resolves every active alert created before {@code cutoff} and tags it as auto-resolved.
     *
     * @return the alerts this call resolved
     */
    @Transactional
    public List<Alert> autoResolveOlderThan(Instant cutoff, Instant resolvedAt) {
        try {
            List<Alert> stale = alertRepository.lockByStatusCreatedBefore(AlertStatus.ACTIVE, cutoff);
            Map<String, Object> metadata = resolutionMetadata(AUTO_RESOLVED_BY,
                    "Auto-resolved: active since before " + cutoff, resolvedAt);
            metadata.put("auto_resolved", true);
            for (Alert alert : stale) {
                alert.resolve(resolvedAt);
                alert.mergeMetadata(metadata);
                alert.setUpdatedAt(resolvedAt);
            }
            List<Alert> saved = alertRepository.saveAllAndFlush(stale);
            log.info("Auto-resolved {} alerts created before {}", saved.size(), cutoff);
            return saved;
        } catch (DataAccessException e) {
            throw storeFailure("Failed to auto-resolve alerts older than " + cutoff, e);
        }
    }

    @Transactional(readOnly = true)
    public AlertStatistics statistics(String region) {
        try {
            AlertFilter scope = AlertFilter.builder().region(region).build();
            long total = count(scope);
            long active = count(scope.toBuilder().status(AlertStatus.ACTIVE).build());
            long acknowledged = count(scope.toBuilder().acknowledged(true).build());
            long resolved = count(scope.toBuilder().status(AlertStatus.RESOLVED).build());

            return AlertStatistics.builder()
                    .total(total)
                    .active(active)
                    .acknowledged(acknowledged)
                    .resolved(resolved)
                    .byType(toCountMap(alertRepository.countByType(region)))
                    .byRegion(toCountMap(alertRepository.countByRegion(region)))
                    .avgResolutionHours(Optional.ofNullable(alertRepository.averageResolutionHours(region)).orElse(0.0))
                    .build();
        } catch (DataAccessException e) {
            throw storeFailure("Failed to compute alert statistics", e);
        }
    }

    private static AlertServiceException storeFailure(String message, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException) {
            return new ConnectivityException("postgres", e);
        }
        return new AlertPersistenceException(message, e);
    }

    private long count(AlertFilter filter) {
        return alertRepository.count(AlertSpecifications.matching(filter));
    }

    /**
     * Applies the non-null fields of {@code update}. Acknowledgement and resolution go
     * through the entity's own transitions.
     */
    static void apply(Alert alert, AlertUpdate update) {
        if (Boolean.TRUE.equals(update.getAcknowledged())) {
            alert.acknowledge(
                    update.getAcknowledgedBy() != null ? update.getAcknowledgedBy() : alert.getAcknowledgedBy(),
                    update.getAcknowledgedAt() != null ? update.getAcknowledgedAt() : alert.getAcknowledgedAt());
        } else if (update.getAcknowledged() != null) {
            alert.setAcknowledged(false);
        }
        if (update.getStatus() == AlertStatus.RESOLVED) {
            alert.resolve(update.getResolvedAt() != null ? update.getResolvedAt() : alert.getResolvedAt());
        } else if (update.getStatus() != null) {
            alert.setStatus(update.getStatus());
        }
        alert.mergeMetadata(update.getMetadata());
    }

    static Map<String, Object> resolutionMetadata(String resolvedBy, String note, Instant at) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resolved_by", resolvedBy);
        if (note != null) {
            metadata.put("resolution_note", note);
        }
        metadata.put("resolution_timestamp", at.toString());
        return metadata;
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }
}
