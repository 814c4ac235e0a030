package com.dtech.observability;

import java.util.UUID;

/**
 * Immutable per-request correlation data mirrored into the SLF4J MDC.
 *
 * @param correlationId id shared by every log line of one business flow, propagated through
 *                      {@code X-Correlation-ID}
 * @param requestId     id of this particular request
 * @param tenantId      vendor the request acts on (nullable for routes without a vendor)
 * @param userId        authenticated caller (nullable until authorization succeeds)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String tenantId,
        String userId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a context for a new request. A blank incoming correlation id is replaced by a random one.
     */
    public static CorrelationContext start(String incomingCorrelationId) {
        String correlationId = incomingCorrelationId == null || incomingCorrelationId.isBlank()
                ? UUID.randomUUID().toString()
                : incomingCorrelationId.strip();
        return new CorrelationContext(correlationId, UUID.randomUUID().toString(), null, null);
    }

    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, requestId, tenantId, userId);
    }

    public CorrelationContext withUser(String userId) {
        return new CorrelationContext(correlationId, requestId, tenantId, userId);
    }
}
