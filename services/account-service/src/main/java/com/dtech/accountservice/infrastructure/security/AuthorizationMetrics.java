package com.dtech.accountservice.infrastructure.security;

import com.dtech.observability.MetricFactory;
import com.dtech.security.AuthorizationFailure;
import java.util.Locale;

/**
 * Counts authorization decisions as {@value #DECISIONS} tagged by {@code outcome} and
 * {@code reason}.
 */
public class AuthorizationMetrics {

    static final String DECISIONS = "dtech.authorization.decisions";

    private final MetricFactory metrics;

    public AuthorizationMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    void granted(String credential) {
        metrics.counter(DECISIONS, "Authorization decisions", "outcome", "granted", "reason", "none",
                "credential", credential).increment();
    }

    void denied(String credential, AuthorizationFailure failure) {
        metrics.counter(DECISIONS, "Authorization decisions", "outcome", "denied",
                "reason", failure.kind().name().toLowerCase(Locale.ROOT), "credential", credential).increment();
    }
}
