package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.IdentityStore;
import com.dtech.security.MembershipStore;
import com.dtech.security.SessionTokenVerifier;
import com.dtech.security.TenantStore;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * Builds a {@link HandlerGuard} for every mapped handler method once the context is refreshed, so
 * a misconfigured route fails startup instead of its first request.
 */
public class HandlerGuardRegistry implements ApplicationListener<ContextRefreshedEvent> {

    private static final Logger log = LoggerFactory.getLogger(HandlerGuardRegistry.class);

    private final HandlerGuardFactory factory;
    private final Map<Method, HandlerGuard> guards = new ConcurrentHashMap<>();

    public HandlerGuardRegistry(
            SessionTokenVerifier sessionTokens,
            IdentityStore identities,
            MembershipStore memberships,
            TenantStore tenants) {
        this(new HandlerGuardFactory(sessionTokens, identities, memberships, tenants));
    }

    HandlerGuardRegistry(HandlerGuardFactory factory) {
        this.factory = factory;
    }

    @Override
    public void onApplicationEvent(ContextRefreshedEvent event) {
        event.getApplicationContext().getBeansOfType(RequestMappingHandlerMapping.class).values()
                .forEach(mapping -> mapping.getHandlerMethods().forEach(
                        (info, handlerMethod) -> register(handlerMethod, info.getPatternValues())));
        long guarded = guards.values().stream().filter(guard -> guard != HandlerGuard.PUBLIC).count();
        log.info("Security guards ready for {} handlers ({} public)", guards.size(), guards.size() - guarded);
    }

    HandlerGuard register(HandlerMethod handlerMethod, Collection<String> patterns) {
        return guards.computeIfAbsent(handlerMethod.getMethod(),
                method -> factory.create(method, handlerMethod.getBeanType(), patterns));
    }

    /**
     * Guard of {@code handlerMethod}; built on demand for handlers registered after startup.
     */
    HandlerGuard guardFor(HandlerMethod handlerMethod, Collection<String> patterns) {
        HandlerGuard guard = guards.get(handlerMethod.getMethod());
        return guard != null ? guard : register(handlerMethod, patterns);
    }
}
