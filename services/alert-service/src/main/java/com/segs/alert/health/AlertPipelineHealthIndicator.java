package com.segs.alert.health;

import com.segs.alert.cache.ConditionStateCache;
import com.segs.alert.kafka.AlertStreamConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of the alert pipeline, exposed as {@code alertPipeline}.
 *
 * <p>A lost cache only degrades the service because the alert store stays
 * authoritative; stopped stream listeners take it down.
 */
@Slf4j
@Component("alertPipeline")
@RequiredArgsConstructor
public class AlertPipelineHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Condition state cache unavailable");

    private static final List<String> LISTENER_IDS = List.of(
            AlertStreamConsumer.AGGREGATES_LISTENER_ID,
            AlertStreamConsumer.ANOMALIES_LISTENER_ID);

    private final ConditionStateCache conditionStateCache;
    private final KafkaListenerEndpointRegistry listenerRegistry;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean listenersRunning = true;
        for (String id : LISTENER_IDS) {
            MessageListenerContainer container = listenerRegistry.getListenerContainer(id);
            boolean running = container != null && container.isRunning();
            details.put(id, running ? "running" : "stopped");
            listenersRunning &= running;
        }

        boolean cacheAvailable = conditionStateCache.isAvailable();
        details.put("conditionStateCache", cacheAvailable ? "available" : "unavailable");

        if (!listenersRunning) {
            return Health.down().withDetails(details).build();
        }
        if (!cacheAvailable) {
            log.warn("Alert pipeline degraded: condition state cache unavailable");
            return Health.status(DEGRADED).withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
