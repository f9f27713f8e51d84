package com.healthwatch.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should keep all fields")
    void shouldKeepFields() {
        var ctx = new CorrelationContext("run-1", "status-monitor", "web-01");

        assertThat(ctx.correlationId()).isEqualTo("run-1");
        assertThat(ctx.component()).isEqualTo("status-monitor");
        assertThat(ctx.hostName()).isEqualTo("web-01");
    }

    @Test
    @DisplayName("of() leaves optional fields null")
    void ofLeavesOptionalFieldsNull() {
        var ctx = CorrelationContext.of("req-1");

        assertThat(ctx.component()).isNull();
        assertThat(ctx.hostName()).isNull();
    }

    @Test
    @DisplayName("should reject null or blank correlation ID")
    void shouldRejectBlankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(null, "c", "h"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> CorrelationContext.of("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
