package com.flagship.credit_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id for the current request.
 *
 * The id is echoed in the X-Correlation-ID response header and printed in every
 * log line through the MDC, together with the user and transaction being processed.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the correlation id of the request being served, or null outside a request.
     */
    public static String getCorrelationId() {
        return correlationId.get();
    }

    /**
     * Sets the correlation id for the current thread. Blank or oversized values are replaced.
     */
    public static String setCorrelationId(String id) {
        String accepted = id != null && !id.isBlank() && id.length() <= MAX_CORRELATION_ID_LENGTH
            ? id
            : generateCorrelationId();
        correlationId.set(accepted);
        return accepted;
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
