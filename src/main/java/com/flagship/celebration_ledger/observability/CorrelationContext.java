package com.flagship.celebration_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys this service logs under, and the scope of one unit of work
 * (an HTTP request or a consumed Kafka record).
 *
 * The correlation ID arrives in the {@value #CORRELATION_ID_HEADER} header on
 * both transports; the celebration and contributor keys are set by the
 * services while they work on one record.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CELEBRATION_ID_MDC_KEY = "celebrationId";
    public static final String CONTRIBUTOR_ID_MDC_KEY = "contributorId";

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work under the incoming correlation ID, or a new one
     * when none was sent.
     *
     * @return the correlation ID now in MDC
     */
    public static String begin(String incomingId) {
        String id = incomingId != null && !incomingId.isBlank()
                ? incomingId
                : UUID.randomUUID().toString().substring(0, 8);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Ends the unit of work; pooled threads must not carry keys over.
     */
    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CELEBRATION_ID_MDC_KEY);
        MDC.remove(CONTRIBUTOR_ID_MDC_KEY);
    }
}
