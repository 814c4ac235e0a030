package com.dtech.accountservice.infrastructure.security;

import com.dtech.observability.CorrelationContextHolder;
import com.dtech.security.AuthorizationException;
import com.dtech.security.AuthorizationFailure;
import com.dtech.security.AuthorizationOutcome;
import com.dtech.security.AuthorizedContext;
import com.dtech.security.TokenAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces the {@link HandlerGuard} of the matched handler: the credential first, then the vendor
 * state. A denial is thrown as {@link AuthorizationException} and rendered by the exception handler.
 * On success the {@link AuthorizedContext} is stored under {@link #AUTHORIZED_CONTEXT} and the caller
 * and vendor ids are added to the correlation context.
 */
public class AuthorizationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationInterceptor.class);

    public static final String AUTHORIZED_CONTEXT = AuthorizationInterceptor.class.getName() + ".context";
    static final String TOKEN_PARAMETER = "token";

    private final HandlerGuardRegistry guards;
    private final TokenAuthenticator tokenAuthenticator;
    private final AuthorizationMetrics metrics;

    public AuthorizationInterceptor(
            HandlerGuardRegistry guards, TokenAuthenticator tokenAuthenticator, AuthorizationMetrics metrics) {
        this.guards = guards;
        this.tokenAuthenticator = tokenAuthenticator;
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerGuard guard = guards.guardFor((HandlerMethod) handler, bestMatchingPattern(request));
        if (guard == HandlerGuard.PUBLIC) {
            return true;
        }
        String vendorId = vendorId(request);

        if (guard.credential() != HandlerGuard.Credential.NONE) {
            String credential = guard.credential().name().toLowerCase(Locale.ROOT);
            AuthorizationOutcome outcome = authenticate(guard, request, vendorId);
            if (!outcome.isGranted()) {
                metrics.denied(credential, outcome.failure());
                log.warn("Denied {} {}: {} {}", request.getMethod(), request.getRequestURI(),
                        outcome.failure().kind(), outcome.failure().message());
                throw new AuthorizationException(outcome.failure());
            }
            metrics.granted(credential);
            AuthorizedContext context = outcome.context();
            request.setAttribute(AUTHORIZED_CONTEXT, context);
            CorrelationContextHolder.update(correlation -> correlation.withUser(context.userId()).withTenant(vendorId));
        }

        if (guard.stateGate() != null) {
            Optional<AuthorizationFailure> failure = guard.stateGate().check(vendorId);
            if (failure.isPresent()) {
                metrics.denied("tenant_state", failure.get());
                log.warn("Vendor {} state rejected {} {}", vendorId, request.getMethod(), request.getRequestURI());
                throw new AuthorizationException(failure.get());
            }
        }
        return true;
    }

    private AuthorizationOutcome authenticate(HandlerGuard guard, HttpServletRequest request, String vendorId) {
        switch (guard.credential()) {
            case SESSION:
                return guard.authorizer().authorize(request.getHeader(HttpHeaders.AUTHORIZATION), vendorId);
            case INVITATION_TOKEN:
                return tokenAuthenticator.authenticateInvitation(request.getParameter(TOKEN_PARAMETER));
            case RESET_PASSWORD_TOKEN:
                return tokenAuthenticator.authenticateResetPassword(request.getParameter(TOKEN_PARAMETER));
            default:
                throw new IllegalStateException("No credential to authenticate: " + guard.credential());
        }
    }

    private static String vendorId(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object value = map.get(HandlerGuardFactory.VENDOR_ID);
            return value == null ? null : value.toString();
        }
        return null;
    }

    private static Set<String> bestMatchingPattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? Set.of() : Set.of(pattern.toString());
    }
}
