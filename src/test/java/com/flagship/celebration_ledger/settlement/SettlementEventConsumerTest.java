package com.flagship.celebration_ledger.settlement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import com.flagship.celebration_ledger.config.JacksonConfig;
import com.flagship.celebration_ledger.observability.CorrelationContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for manual offset handling in the settlement consumer.
 *
 * These tests verify that:
 * - Handled events are acknowledged
 * - Unparseable and malformed messages are acknowledged and skipped
 * - Retryable failures are left unacknowledged for redelivery
 * - The correlation ID header reaches the logging context
 */
class SettlementEventConsumerTest {

    private static final UUID RECORD_ID = UUID.fromString("7d1c2f9e-3b8a-4c55-9e21-0f6a8b3c4d5e");

    private SettlementCoordinator coordinator;
    private Acknowledgment ack;
    private SettlementEventConsumer consumer;

    @BeforeEach
    void setUp() {
        coordinator = mock(SettlementCoordinator.class);
        ack = mock(Acknowledgment.class);
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        consumer = new SettlementEventConsumer(coordinator, objectMapper);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(Exception e) {
        System.out.println("✓ EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private static ConsumerRecord<String, String> message(String topic, String value) {
        return new ConsumerRecord<>(topic, 0, 42L, "pay-1", value);
    }

    private static String settlementJson() {
        return """
                {"idempotencyKey": "pay-1", "recordId": "%s", "outcome": "captured",
                 "providerRef": "ch_123", "occurredAt": "2024-06-10T15:00:00Z"}
                """.formatted(RECORD_ID);
    }

    private static SettlementResult applied() {
        return SettlementResult.builder()
                .disposition(SettlementDisposition.APPLIED)
                .recordId(RECORD_ID)
                .status(CelebrationStatus.RESOLVED)
                .sequenceNumber(2)
                .build();
    }

    @Test
    @DisplayName("Handled settlement should be acknowledged")
    void testConsumeSettlement_Acknowledged() {
        printTestHeader("Settlement Acknowledged");

        when(coordinator.apply(any(SettlementEvent.class))).thenReturn(applied());
        printInput("Payload", settlementJson());

        consumer.consumeSettlement(message("celebration-settlements", settlementJson()), ack);

        ArgumentCaptor<SettlementEvent> captor = ArgumentCaptor.forClass(SettlementEvent.class);
        verify(coordinator).apply(captor.capture());
        verify(ack).acknowledge();

        SettlementEvent event = captor.getValue();
        assertEquals("pay-1", event.getIdempotencyKey());
        assertEquals(RECORD_ID, event.getRecordId());
        assertEquals(SettlementOutcome.CAPTURED, event.getOutcome());
        printSuccess("Parsed, applied and acknowledged");
    }

    @Test
    @DisplayName("Lifecycle trigger should be parsed with its kind")
    void testConsumeLifecycle_Acknowledged() {
        printTestHeader("Lifecycle Acknowledged");

        when(coordinator.apply(any(LifecycleTriggerEvent.class))).thenReturn(applied());
        String json = """
                {"eventKey": "evt-1", "recordId": "%s", "kind": "CONDITION_RESOLVED",
                 "metadata": {"type": "resolution", "billId": "hr-1234-118"}}
                """.formatted(RECORD_ID);

        consumer.consumeLifecycle(message("celebration-lifecycle", json), ack);

        ArgumentCaptor<LifecycleTriggerEvent> captor = ArgumentCaptor.forClass(LifecycleTriggerEvent.class);
        verify(coordinator).apply(captor.capture());
        verify(ack).acknowledge();
        assertEquals(LifecycleTriggerKind.CONDITION_RESOLVED, captor.getValue().getKind());
        assertEquals(CelebrationStatus.RESOLVED, captor.getValue().getMetadata().appliesTo());
    }

    @Test
    @DisplayName("Unparseable message should be acknowledged and skipped")
    void testConsume_PoisonMessageSkipped() {
        printTestHeader("Poison Message");

        consumer.consumeSettlement(message("celebration-settlements", "{not json"), ack);

        verify(coordinator, never()).apply(any(SettlementEvent.class));
        verify(ack).acknowledge();
        printSuccess("Poison message does not block the partition");
    }

    @Test
    @DisplayName("Malformed event should be acknowledged and skipped")
    void testConsume_MalformedEventSkipped() {
        printTestHeader("Malformed Event");

        when(coordinator.apply(any(SettlementEvent.class)))
                .thenThrow(new IllegalArgumentException("Settlement event must carry an outcome"));

        consumer.consumeSettlement(message("celebration-settlements", settlementJson()), ack);

        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Retryable failure should be rethrown without acknowledging")
    void testConsume_RetryableNotAcknowledged() {
        printTestHeader("Retryable Failure");

        when(coordinator.apply(any(SettlementEvent.class)))
                .thenThrow(new RetryableSettlementException("Ledger kept changing"));

        RetryableSettlementException e = assertThrows(RetryableSettlementException.class,
                () -> consumer.consumeSettlement(message("celebration-settlements", settlementJson()), ack));
        printExpectedException(e);

        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Correlation ID header should be in the MDC while handling and cleared afterwards")
    void testConsume_CorrelationIdPropagated() {
        printTestHeader("Correlation ID");

        AtomicReference<String> seen = new AtomicReference<>();
        when(coordinator.apply(any(SettlementEvent.class))).thenAnswer(invocation -> {
            seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            return applied();
        });

        ConsumerRecord<String, String> record = message("celebration-settlements", settlementJson());
        record.headers().add(new RecordHeader(CorrelationContext.CORRELATION_ID_HEADER,
                "corr-1234".getBytes(StandardCharsets.UTF_8)));

        consumer.consumeSettlement(record, ack);

        assertEquals("corr-1234", seen.get());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        printSuccess("Correlation ID carried through and cleaned up");
    }
}
