package com.dtech.accountservice.config;

import com.dtech.accountservice.domain.UserRepository;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Creates the configured {@code dtech.service.bootstrap-admin} as an activated ADMIN when no identity
 * uses its e-mail yet, so a fresh deployment has someone who can invite everybody else.
 */
@Component
public class BootstrapAdminInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminInitializer.class);

    private final AccountServiceProperties properties;
    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;

    public BootstrapAdminInitializer(
            AccountServiceProperties properties, UserRepository users, PasswordEncoder passwordEncoder) {
        this.properties = properties;
        this.users = users;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(ApplicationArguments args) {
        AccountServiceProperties.BootstrapAdmin admin = properties.bootstrapAdmin();
        if (admin == null) {
            return;
        }
        String email = admin.email().strip().toLowerCase(Locale.ROOT);
        if (users.findByEmail(email).isPresent()) {
            log.debug("Bootstrap admin already present");
            return;
        }
        Identity created = users.save(new Identity(
                UUID.randomUUID().toString(), email, null, null, Role.ADMIN,
                passwordEncoder.encode(admin.password()), true));
        log.info("Created bootstrap admin {}", created.id());
    }
}
