package com.segs.alert.config;

import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.exception.InvalidStreamMessageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Error handling for the inbound alert streams. Spring Boot wires this handler
 * into the default listener container factory.
 *
 * <p>Unparsable records go straight to {@code <topic>.DLT}; other failures are
 * redelivered with a fixed back-off first.
 */
@Slf4j
@Configuration
public class KafkaConsumerConfig {

    @Bean
    public DefaultErrorHandler alertStreamErrorHandler(KafkaTemplate<String, String> kafkaTemplate,
                                                       AlertProperties properties) {
        AlertProperties.Consumer consumer = properties.getConsumer();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate);
        FixedBackOff backOff = new FixedBackOff(consumer.getRetryInterval().toMillis(), consumer.getRetryAttempts());

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(InvalidStreamMessageException.class);
        errorHandler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Redelivery {} of {}-{}@{}: {}", deliveryAttempt, record.topic(), record.partition(),
                        record.offset(), ex.getMessage()));

        log.info("Alert stream error handler: retries={}, interval={}, dead-letter suffix=.DLT",
                consumer.getRetryAttempts(), consumer.getRetryInterval());
        return errorHandler;
    }
}
