package com.dtech.accountservice.config;

import com.dtech.accountservice.domain.AccountLinks;
import com.dtech.accountservice.domain.AccountNotifier;
import com.dtech.accountservice.domain.MembershipRepository;
import com.dtech.accountservice.domain.UserAccountService;
import com.dtech.accountservice.domain.UserRepository;
import com.dtech.accountservice.domain.VendorMembershipService;
import com.dtech.accountservice.domain.VendorRepository;
import com.dtech.accountservice.domain.VendorService;
import com.dtech.accountservice.infrastructure.notification.LoggingAccountNotifier;
import com.dtech.observability.SensitiveDataRedactor;
import com.dtech.security.InvitationTokenCodec;
import com.dtech.security.JwtSessionTokenService;
import com.dtech.security.ResetPasswordTokenCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Domain services of the account flows.
 */
@Configuration(proxyBeanMethods = false)
public class AccountConfig {

    @Bean
    public AccountLinks accountLinks(AccountServiceProperties properties) {
        return new AccountLinks(properties.appUrl());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public AccountNotifier accountNotifier(SensitiveDataRedactor redactor) {
        return new LoggingAccountNotifier(redactor);
    }

    @Bean
    public UserAccountService userAccountService(
            UserRepository users,
            MembershipRepository memberships,
            PasswordEncoder passwordEncoder,
            JwtSessionTokenService sessionTokens,
            InvitationTokenCodec invitationTokens,
            ResetPasswordTokenCodec resetTokens,
            AccountNotifier notifier,
            AccountLinks links) {
        return new UserAccountService(
                users, memberships, passwordEncoder, sessionTokens, invitationTokens, resetTokens, notifier, links);
    }

    @Bean
    public VendorService vendorService(VendorRepository vendors) {
        return new VendorService(vendors);
    }

    @Bean
    public VendorMembershipService vendorMembershipService(
            VendorService vendors,
            UserAccountService accounts,
            MembershipRepository memberships,
            InvitationTokenCodec invitationTokens,
            AccountNotifier notifier,
            AccountLinks links) {
        return new VendorMembershipService(vendors, accounts, memberships, invitationTokens, notifier, links);
    }
}
