package com.healthwatch.monitoring.testing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthwatch.statusmodel.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScriptedStatusProbe")
class ScriptedStatusProbeTest {

    @Test
    @DisplayName("unscripted names use the default status")
    void defaultStatus() {
        var probe = new ScriptedStatusProbe();

        assertThat(probe.checkStatus("httpd")).isEqualTo(HealthStatus.DOWN);
        assertThat(probe.defaultStatus(HealthStatus.UP).checkStatus("httpd")).isEqualTo(HealthStatus.UP);
    }

    @Test
    @DisplayName("respond() overrides an earlier failure")
    void respondClearsFailure() {
        var probe = new ScriptedStatusProbe()
                .failWith("httpd", new IllegalStateException("boom"))
                .respond("httpd", HealthStatus.UP);

        assertThat(probe.checkStatus("httpd")).isEqualTo(HealthStatus.UP);
    }

    @Test
    @DisplayName("scripted failures are thrown and calls are recorded")
    void failuresAndCalls() {
        var probe = new ScriptedStatusProbe().failWith("rabbitmq", new IllegalStateException("boom"));

        probe.checkStatus("httpd");
        assertThatThrownBy(() -> probe.probe("rabbitmq")).hasMessage("boom");

        assertThat(probe.calls()).containsExactly("httpd", "rabbitmq");
    }

    @Test
    @DisplayName("host and time are configurable")
    void hostAndTime() {
        var probe = new ScriptedStatusProbe().host("db-01").now("2024-02-01T00:00:00Z");

        assertThat(probe.currentHost()).isEqualTo("db-01");
        assertThat(probe.now()).isEqualTo("2024-02-01T00:00:00Z");
    }
}
