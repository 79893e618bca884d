package com.flagship.celebration_ledger.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.celebration_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Kafka consumer for settlement and lifecycle events.
 *
 * Offsets are acknowledged manually:
 * - after the coordinator has handled the event (including duplicates and drops)
 * - for messages that cannot be parsed or are malformed, which would never succeed
 *
 * A {@link RetryableSettlementException} is rethrown unacknowledged so the
 * container redelivers the message.
 */
@Component
@ConditionalOnProperty(name = "settlement.consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    private final SettlementCoordinator coordinator;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.settlements:celebration-settlements}",
        groupId = "${spring.kafka.consumer.group-id:celebration-ledger-consumers}"
    )
    public void consumeSettlement(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consume(record, ack, SettlementEvent.class, coordinator::apply);
    }

    @KafkaListener(
        topics = "${kafka.topic.lifecycle:celebration-lifecycle}",
        groupId = "${spring.kafka.consumer.group-id:celebration-ledger-consumers}"
    )
    public void consumeLifecycle(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consume(record, ack, LifecycleTriggerEvent.class, coordinator::apply);
    }

    private <E> void consume(ConsumerRecord<String, String> record, Acknowledgment ack,
                             Class<E> eventType, Function<E, SettlementResult> handler) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        CorrelationContext.begin(headerValue(record, CorrelationContext.CORRELATION_ID_HEADER));
        try {
            E event;
            try {
                event = objectMapper.readValue(record.value(), eventType);
            } catch (JsonProcessingException e) {
                log.warn("Could not parse {} at offset {}, acknowledging to skip: {}",
                        eventType.getSimpleName(), record.offset(), e.getOriginalMessage());
                ack.acknowledge();
                return;
            }

            SettlementResult result;
            try {
                result = handler.apply(event);
            } catch (IllegalArgumentException e) {
                log.warn("Malformed {} at offset {}, acknowledging to skip: {}",
                        eventType.getSimpleName(), record.offset(), e.getMessage());
                ack.acknowledge();
                return;
            }

            ack.acknowledge();
            log.info("Processed {}: disposition={}, recordId={}",
                    eventType.getSimpleName(), result.getDisposition(), result.getRecordId());

        } catch (RetryableSettlementException e) {
            log.warn("Retryable failure at offset {}, leaving unacknowledged: {}", record.offset(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null && header.value() != null
                ? new String(header.value(), StandardCharsets.UTF_8)
                : null;
    }
}
