package com.segs.alert.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.entity.Alert;
import com.segs.alert.mapper.AlertMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Publishes processed alerts and status updates, keyed by alert id.
 *
 * <p>Publication is best effort: a failed or rejected send is logged and counted,
 * never thrown, because the alert store already holds the record. Sends go through
 * the {@code alertPublisher} circuit breaker so a dead broker fails fast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEventPublisher {

    static final String SOURCE = "alert-service";
    private static final String CONTENT_TYPE = "application/json";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final CircuitBreaker alertPublisherCircuitBreaker;
    private final AlertProperties properties;
    private final AlertMapper alertMapper;
    private final Clock clock;

    public void publishProcessedAlert(Alert alert) {
        ProcessedAlertEvent event = ProcessedAlertEvent.builder()
                .alert(alertMapper.toResponse(alert))
                .processingTimestamp(clock.instant())
                .source(SOURCE)
                .build();

        String topic = properties.getTopics().getProcessed();
        ProducerRecord<String, String> record = createRecord(topic, alert, event);
        if (record == null) {
            return;
        }
        addHeader(record, "alert-type", alert.getType());
        addHeader(record, "alert-severity", alert.getSeverity().value());
        addHeader(record, "alert-status", alert.getStatus().value());
        addHeader(record, "alert-region", alert.getRegion());
        addHeader(record, "alert-meter-id", alert.getMeterId());
        send(record);
    }

    public void publishStatusUpdate(Alert alert) {
        AlertStatusUpdateEvent event = AlertStatusUpdateEvent.builder()
                .alertId(alert.getId())
                .status(alert.getStatus())
                .timestamp(clock.instant())
                .metadata(AlertStatusUpdateEvent.StatusMetadata.builder()
                        .acknowledged(alert.isAcknowledged())
                        .acknowledgedBy(alert.getAcknowledgedBy())
                        .acknowledgedAt(alert.getAcknowledgedAt())
                        .resolvedAt(alert.getResolvedAt())
                        .updatedAt(alert.getUpdatedAt())
                        .build())
                .source(SOURCE)
                .build();

        String topic = properties.getTopics().getStatusUpdates();
        ProducerRecord<String, String> record = createRecord(topic, alert, event);
        if (record == null) {
            return;
        }
        addHeader(record, "message-type", "status-update");
        addHeader(record, "alert-status", alert.getStatus().value());
        send(record);
    }

    private ProducerRecord<String, String> createRecord(String topic, Alert alert, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event for alert {} to topic {}", alert.getId(), topic, e);
            count(topic, "serialization_error");
            return null;
        }
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, alert.getId().toString(), payload);
        addHeader(record, "content-type", CONTENT_TYPE);
        addHeader(record, "source", SOURCE);
        return record;
    }

    private void send(ProducerRecord<String, String> record) {
        String topic = record.topic();
        if (!alertPublisherCircuitBreaker.tryAcquirePermission()) {
            log.warn("Circuit breaker open, dropping event for alert {} on topic {}", record.key(), topic);
            count(topic, "rejected");
            return;
        }

        long start = System.nanoTime();
        try {
            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                long elapsed = System.nanoTime() - start;
                if (ex == null) {
                    alertPublisherCircuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);
                    count(topic, "success");
                    log.debug("Published alert {} to {} partition={} offset={}", record.key(), topic,
                            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                } else {
                    alertPublisherCircuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, ex);
                    count(topic, "failure");
                    log.error("Failed to publish alert {} to {}: {}", record.key(), topic, ex.getMessage());
                }
            });
        } catch (Exception e) {
            alertPublisherCircuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            count(topic, "failure");
            log.error("Failed to publish alert {} to {}", record.key(), topic, e);
        }
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8)));
        }
    }

    private void count(String topic, String outcome) {
        meterRegistry.counter("segs.alerts.published", "topic", topic, "outcome", outcome).increment();
    }
}
