package com.dtech.accountservice.config;

import com.dtech.accountservice.domain.MembershipRepository;
import com.dtech.accountservice.domain.UserRepository;
import com.dtech.accountservice.domain.VendorRepository;
import com.dtech.accountservice.infrastructure.security.AuthorizationInterceptor;
import com.dtech.accountservice.infrastructure.security.AuthorizationMetrics;
import com.dtech.accountservice.infrastructure.security.HandlerGuardRegistry;
import com.dtech.observability.MetricFactory;
import com.dtech.security.InvitationTokenCodec;
import com.dtech.security.JwtSessionTokenService;
import com.dtech.security.ResetPasswordTokenCodec;
import com.dtech.security.TokenAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Token codecs, password hashing and the request guard machinery.
 */
@Configuration(proxyBeanMethods = false)
public class SecurityConfig {

    /** Matches the cost factor of the hashes already in use. */
    static final int BCRYPT_STRENGTH = 8;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JwtSessionTokenService sessionTokenService(TokenProperties tokens, Clock clock) {
        return new JwtSessionTokenService(tokens.auth().secret(), tokens.auth().expiry(), clock);
    }

    @Bean
    public InvitationTokenCodec invitationTokenCodec(TokenProperties tokens, UserRepository users) {
        return new InvitationTokenCodec(tokens.invitation().secret(), users);
    }

    @Bean
    public ResetPasswordTokenCodec resetPasswordTokenCodec(TokenProperties tokens, Clock clock) {
        return new ResetPasswordTokenCodec(tokens.resetPassword().secret(), tokens.resetPassword().expiry(), clock);
    }

    @Bean
    public TokenAuthenticator tokenAuthenticator(
            InvitationTokenCodec invitations, ResetPasswordTokenCodec resets, UserRepository users) {
        return new TokenAuthenticator(invitations, resets, users);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AccountServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public HandlerGuardRegistry handlerGuardRegistry(
            JwtSessionTokenService sessions,
            UserRepository users,
            MembershipRepository memberships,
            VendorRepository vendors) {
        return new HandlerGuardRegistry(sessions, users, memberships, vendors);
    }

    @Bean
    public AuthorizationInterceptor authorizationInterceptor(
            HandlerGuardRegistry guards, TokenAuthenticator tokenAuthenticator, MetricFactory metrics) {
        return new AuthorizationInterceptor(guards, tokenAuthenticator, new AuthorizationMetrics(metrics));
    }
}
