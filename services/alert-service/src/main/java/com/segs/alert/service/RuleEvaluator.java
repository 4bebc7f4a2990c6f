package com.segs.alert.service;

import com.segs.alert.cache.ConditionStateCache;
import com.segs.alert.cache.InactiveMeter;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.dto.AnomalyEventMessage;
import com.segs.alert.dto.RegionalAggregateMessage;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertTypes;
import com.segs.alert.entity.ConditionKey;
import com.segs.alert.entity.Severity;
import com.segs.alert.exception.DuplicateAlertSuppressedException;
import com.segs.alert.exception.InvalidStreamMessageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns inbound stream messages into alert creation requests.
 *
 * <p>All time arithmetic uses the message's own timestamp, so replayed or late
 * messages are evaluated the same way as live ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleEvaluator {

    static final String ANOMALY_SOURCE = "stream-processor";

    private final ConditionStateCache conditionStateCache;
    private final AlertLifecycleManager lifecycleManager;
    private final AlertProperties properties;

    /**
     * @return the alerts raised by this aggregate
     */
    public List<Alert> evaluateRegionalAggregate(RegionalAggregateMessage message) {
        validate(message);
        String region = message.getRegion();
        Instant at = message.getTimestamp();
        Set<String> reporting = message.getActiveMeters() == null
                ? Set.of() : new HashSet<>(message.getActiveMeters());

        conditionStateCache.touchMetersLastSeen(reporting, region, at);
        conditionStateCache.recordRegionLoad(region, message.getLoadPercentage(), at);

        List<Alert> raised = new ArrayList<>();
        checkOverload(message, at).ifPresent(raised::add);
        raised.addAll(checkOutages(region, reporting, at));
        return raised;
    }

    /**
     * Forwards an upstream anomaly as an alert. Events of any other type are ignored.
     */
    public Optional<Alert> evaluateAnomalyEvent(AnomalyEventMessage event) {
        if (!AlertTypes.ANOMALY.equals(event.getType())) {
            log.debug("Ignoring event id={} of type={}", event.getId(), event.getType());
            return Optional.empty();
        }
        if (event.getSeverity() == null || event.getMessage() == null) {
            throw new InvalidStreamMessageException("Anomaly event " + event.getId() + " lacks severity or message");
        }

        Map<String, Object> metadata = event.getMetadata() == null
                ? new HashMap<>() : new HashMap<>(event.getMetadata());
        metadata.put("source", ANOMALY_SOURCE);
        metadata.put("original_id", event.getId());

        return raise(NewAlert.builder()
                .type(event.getType())
                .severity(event.getSeverity())
                .region(event.getRegion())
                .meterId(event.getMeterId())
                .message(event.getMessage())
                .metadata(metadata)
                .build());
    }

    private Optional<Alert> checkOverload(RegionalAggregateMessage message, Instant at) {
        AlertProperties.Thresholds thresholds = properties.getThresholds();
        double load = message.getLoadPercentage();
        if (load <= thresholds.getOverloadPercent()) {
            return Optional.empty();
        }

        String region = message.getRegion();
        conditionStateCache.recordOverloadWindow(region, at);
        int windows = conditionStateCache.countOverloadWindows(region, thresholds.getOverloadLookback(), at);
        if (windows < thresholds.getOverloadConsecutiveWindows()) {
            log.debug("Region {} over threshold at {}%, {} of {} windows", region, load, windows,
                    thresholds.getOverloadConsecutiveWindows());
            return Optional.empty();
        }

        ConditionKey condition = ConditionKey.of(AlertTypes.REGIONAL_OVERLOAD, region);
        if (conditionStateCache.hasActiveCondition(condition)) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("load_percentage", load);
        metadata.put("meter_count", message.getMeterCount());
        metadata.put("total_consumption", message.getTotalConsumption());
        metadata.put("window_count", windows);
        metadata.put("timestamp", at.toString());

        Optional<Alert> alert = raise(NewAlert.builder()
                .type(AlertTypes.REGIONAL_OVERLOAD)
                .severity(Severity.HIGH)
                .region(region)
                .message(String.format(Locale.ROOT,
                        "Regional overload detected: %.1f%% load for %d consecutive time windows", load, windows))
                .metadata(metadata)
                .build());
        alert.ifPresent(a -> conditionStateCache.setActiveCondition(condition, a.getId()));
        return alert;
    }

    private List<Alert> checkOutages(String region, Set<String> reporting, Instant at) {
        Duration threshold = properties.getThresholds().getMeterOutage();
        List<Alert> raised = new ArrayList<>();

        for (InactiveMeter candidate : conditionStateCache.listInactiveMeters(threshold, at)) {
            // a meter in this message is alive whatever the cache recorded earlier
            if (!region.equals(candidate.region()) || reporting.contains(candidate.meterId())) {
                continue;
            }
            ConditionKey condition = new ConditionKey(AlertTypes.METER_OUTAGE, region, candidate.meterId());
            if (conditionStateCache.hasActiveCondition(condition)) {
                continue;
            }

            long silenceMs = Duration.between(candidate.lastSeen(), at).toMillis();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("last_seen", candidate.lastSeen().toString());
            metadata.put("outage_duration_ms", silenceMs);
            metadata.put("detection_timestamp", at.toString());

            Optional<Alert> alert = raise(NewAlert.builder()
                    .type(AlertTypes.METER_OUTAGE)
                    .severity(Severity.MEDIUM)
                    .region(region)
                    .meterId(candidate.meterId())
                    .message(String.format(Locale.ROOT,
                            "Meter outage detected: No data received for %d seconds", silenceMs / 1000))
                    .metadata(metadata)
                    .build());
            alert.ifPresent(a -> {
                conditionStateCache.setActiveCondition(condition, a.getId());
                raised.add(a);
            });
        }
        return raised;
    }

    private Optional<Alert> raise(NewAlert alert) {
        try {
            return Optional.of(lifecycleManager.createAlert(alert));
        } catch (DuplicateAlertSuppressedException e) {
            log.debug("Skipping duplicate: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static void validate(RegionalAggregateMessage message) {
        if (message.getRegion() == null || message.getRegion().isBlank()) {
            throw new InvalidStreamMessageException("Regional aggregate without region");
        }
        if (message.getTimestamp() == null) {
            throw new InvalidStreamMessageException("Regional aggregate for " + message.getRegion() + " without timestamp");
        }
        if (message.getLoadPercentage() == null) {
            throw new InvalidStreamMessageException("Regional aggregate for " + message.getRegion() + " without load_percentage");
        }
    }
}
