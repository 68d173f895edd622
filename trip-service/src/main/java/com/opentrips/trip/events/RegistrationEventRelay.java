package com.opentrips.trip.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards registration lifecycle events to Kafka once the registration transaction
 * has committed. Attempts that rolled back (including retried ones) never reach Kafka.
 *
 * Topics:
 * - trip-registration-confirmed
 * - trip-registration-cancelled
 *
 * Disabled with {@code trip.events.kafka-enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "trip.events.kafka-enabled", havingValue = "true", matchIfMissing = true)
public class RegistrationEventRelay {

    static final String TOPIC_REGISTRATION_CONFIRMED = "trip-registration-confirmed";
    static final String TOPIC_REGISTRATION_CANCELLED = "trip-registration-cancelled";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRegistrationConfirmed(RegistrationConfirmedEvent event) {
        publishEvent(TOPIC_REGISTRATION_CONFIRMED, String.valueOf(event.getRegistrationId()), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRegistrationCancelled(RegistrationCancelledEvent event) {
        publishEvent(TOPIC_REGISTRATION_CANCELLED, String.valueOf(event.getRegistrationId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
