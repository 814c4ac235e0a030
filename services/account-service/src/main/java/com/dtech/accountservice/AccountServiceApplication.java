package com.dtech.accountservice;

import com.dtech.accountservice.config.AccountServiceProperties;
import com.dtech.accountservice.config.TokenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * DTech account service.
 *
 * <p>Hosts the users and vendor-membership API. Every route is guarded by the annotations in
 * {@code com.dtech.accountservice.infrastructure.security}, which delegate to the authorization core
 * in {@code dtech-security}.
 */
@SpringBootApplication
@EnableConfigurationProperties({AccountServiceProperties.class, TokenProperties.class})
public class AccountServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccountServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccountServiceApplication.class, args);
        log.info("DTech account service started");
    }
}
