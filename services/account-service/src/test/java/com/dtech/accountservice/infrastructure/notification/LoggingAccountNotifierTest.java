package com.dtech.accountservice.infrastructure.notification;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.dtech.accountservice.domain.Vendor;
import com.dtech.observability.SensitiveDataRedactor;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import com.dtech.security.TenantRole;
import com.dtech.security.TenantType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LoggingAccountNotifier")
class LoggingAccountNotifierTest {

    private final LoggingAccountNotifier notifier = new LoggingAccountNotifier(new SensitiveDataRedactor());
    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingAccountNotifier.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private final Identity admin = Identity.invited("admin-1", "admin@dtech.test", Role.ADMIN);
    private final Identity user = Identity.invited("user-1", "user@dtech.test", Role.VENDOR);

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("never writes the token of an invitation link")
    void invitationLinkRedacted() {
        notifier.userInvited(user, admin, "http://app.test/accept-invitation?token=invitation:user@dtech.test:abc123");

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getFormattedMessage()).contains("user-1").contains("admin-1");
            assertThat(event.getFormattedMessage()).doesNotContain("abc123");
        });
    }

    @Test
    @DisplayName("redacts reset links and names the vendor of vendor invitations")
    void resetAndVendorLinks() {
        Vendor vendor = Vendor.create("vendor-1", "Acme", TenantType.INTERNAL, 3);

        notifier.passwordResetRequested(user, "http://app.test/reset-password?token=user@dtech.test:1:ff00");
        notifier.vendorUserInvited(user, TenantRole.VETTER, vendor, admin, "http://app.test/vendors/vendor-1");

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list.get(0).getFormattedMessage()).doesNotContain("ff00");
        assertThat(appender.list.get(1).getFormattedMessage()).contains("vendor-1").contains("VETTER");
    }
}
