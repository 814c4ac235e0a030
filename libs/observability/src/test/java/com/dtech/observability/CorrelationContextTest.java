package com.dtech.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should reject a blank correlation id")
    void shouldRejectBlankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }

    @Test
    @DisplayName("start keeps the incoming correlation id")
    void startKeepsIncomingId() {
        var context = CorrelationContext.start(" abc-123 ");

        assertThat(context.correlationId()).isEqualTo("abc-123");
        assertThat(context.requestId()).isNotBlank();
        assertThat(context.tenantId()).isNull();
    }

    @Test
    @DisplayName("start generates a correlation id when none arrives")
    void startGeneratesId() {
        assertThat(CorrelationContext.start(null).correlationId()).isNotBlank();
        assertThat(CorrelationContext.start("").correlationId())
                .isNotEqualTo(CorrelationContext.start("").correlationId());
    }

    @Test
    @DisplayName("withTenant and withUser keep the other fields")
    void withersKeepFields() {
        var context = CorrelationContext.start("c1").withTenant("v1").withUser("u1");

        assertThat(context.correlationId()).isEqualTo("c1");
        assertThat(context.tenantId()).isEqualTo("v1");
        assertThat(context.userId()).isEqualTo("u1");
    }
}
