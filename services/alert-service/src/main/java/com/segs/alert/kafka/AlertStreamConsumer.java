package com.segs.alert.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.dto.AnomalyEventMessage;
import com.segs.alert.dto.RegionalAggregateMessage;
import com.segs.alert.exception.InvalidStreamMessageException;
import com.segs.alert.service.RuleEvaluator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Inbound side of the alert pipeline: regional aggregates and upstream anomaly events.
 *
 * <p>Each partition is handled by one consumer task, one record at a time. Failures
 * propagate to the container error handler, which retries or dead-letters them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertStreamConsumer {

    public static final String AGGREGATES_LISTENER_ID = "regionalAggregatesListener";
    public static final String ANOMALIES_LISTENER_ID = "anomalyEventsListener";

    private final RuleEvaluator ruleEvaluator;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final AlertProperties properties;

    @KafkaListener(
        id = AGGREGATES_LISTENER_ID,
        topics = "${segs.alert.topics.aggregates:aggregates_1m_regional}",
        groupId = "${spring.kafka.consumer.group-id:alert-service}",
        concurrency = "${segs.alert.consumer.concurrency:3}"
    )
    public void onRegionalAggregate(ConsumerRecord<String, String> record) {
        handle(record, RegionalAggregateMessage.class, message -> {
            log.debug("Evaluating aggregate region={}, load={}%, meters={}",
                    message.getRegion(), message.getLoadPercentage(), message.getMeterCount());
            ruleEvaluator.evaluateRegionalAggregate(message);
        });
    }

    @KafkaListener(
        id = ANOMALIES_LISTENER_ID,
        topics = "${segs.alert.topics.anomalies:alerts}",
        groupId = "${spring.kafka.consumer.group-id:alert-service}",
        concurrency = "${segs.alert.consumer.concurrency:3}"
    )
    public void onAnomalyEvent(ConsumerRecord<String, String> record) {
        handle(record, AnomalyEventMessage.class, event -> {
            log.debug("Processing anomaly event id={}, type={}, region={}",
                    event.getId(), event.getType(), event.getRegion());
            ruleEvaluator.evaluateAnomalyEvent(event);
        });
    }

    private <T> void handle(ConsumerRecord<String, String> record, Class<T> type, Consumer<T> handler) {
        String topic = record.topic();
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();
        String outcome = "success";
        try {
            handler.accept(parse(record, type));
        } catch (InvalidStreamMessageException e) {
            outcome = "invalid";
            log.warn("Invalid message on {}-{}@{}: {}", topic, record.partition(), record.offset(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Failed to process message on {}-{}@{}", topic, record.partition(), record.offset(), e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("segs.stream.processing.duration", "topic", topic));
            meterRegistry.counter("segs.stream.messages", "topic", topic, "outcome", outcome).increment();

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            Duration budget = properties.getConsumer().getMaxProcessingTime();
            if (elapsed.compareTo(budget) > 0) {
                log.warn("Message on {}-{}@{} took {}ms, budget is {}ms", topic, record.partition(),
                        record.offset(), elapsed.toMillis(), budget.toMillis());
            }
        }
    }

    private <T> T parse(ConsumerRecord<String, String> record, Class<T> type) {
        if (record.value() == null || record.value().isBlank()) {
            throw new InvalidStreamMessageException("Empty payload");
        }
        try {
            return objectMapper.readValue(record.value(), type);
        } catch (JsonProcessingException e) {
            throw new InvalidStreamMessageException("Cannot parse " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
