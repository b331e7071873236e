package com.flagship.loyalty_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys used across the service and helpers for scoping them.
 *
 * Card and enrollment ids are bound with try-with-resources so that a log
 * line written inside a ledger write or an enrollment transition carries the
 * subject it concerns, and nothing leaks onto the next request on the thread.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CARD_ID_MDC_KEY = "cardId";
    public static final String ENROLLMENT_ID_MDC_KEY = "enrollmentId";

    // Scanner apps forward whatever the client sent; anything else is replaced.
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Correlation id of the current request, or null outside a request.
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * The inbound header value if it is safe to log, otherwise a fresh id.
     */
    public static String acceptOrGenerate(String inbound) {
        if (inbound != null && ACCEPTED_ID.matcher(inbound).matches()) {
            return inbound;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static MDC.MDCCloseable forCard(UUID cardId) {
        return MDC.putCloseable(CARD_ID_MDC_KEY, String.valueOf(cardId));
    }

    public static MDC.MDCCloseable forEnrollment(UUID enrollmentId) {
        return MDC.putCloseable(ENROLLMENT_ID_MDC_KEY, String.valueOf(enrollmentId));
    }
}
