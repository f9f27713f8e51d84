package com.healthwatch.statusmonitor;

import static org.assertj.core.api.Assertions.assertThat;

import com.healthwatch.monitoring.HealthAggregator;
import com.healthwatch.monitoring.ProcessStatusProbe;
import com.healthwatch.monitoring.StatusProbe;
import com.healthwatch.statusmonitor.config.MonitorProperties;
import com.healthwatch.statusmonitor.runner.MonitorRunner;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * Context tests for the status monitor. The test profile disables the startup pass, so no
 * supervisor command is run.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Status Monitor Application")
class StatusMonitorApplicationTest {

    @Autowired private ApplicationContext context;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("monitor properties are loaded from test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(MonitorProperties.class);

        assertThat(props.application().name()).isEqualTo("testapp");
        assertThat(props.application().dependencies()).containsExactly("redis", "nginx");
        assertThat(props.probe().command()).isEqualTo("systemctl");
        assertThat(props.probe().timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.writeFiles()).isTrue();
        assertThat(props.serviceMode()).isFalse();
    }

    @Test
    @DisplayName("aggregator monitors the configured application")
    void aggregatorUsesConfiguredApplication() {
        var aggregator = context.getBean(HealthAggregator.class);

        assertThat(aggregator.application().name()).isEqualTo("testapp");
        assertThat(aggregator.application().dependencies()).containsExactly("redis", "nginx");
    }

    @Test
    @DisplayName("probe uses the configured timeout")
    void probeUsesConfiguredTimeout() {
        var probe = context.getBean(StatusProbe.class);

        assertThat(probe).isInstanceOf(ProcessStatusProbe.class);
        assertThat(((ProcessStatusProbe) probe).timeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("startup pass is disabled in the test profile")
    void runnerIsDisabled() {
        assertThat(context.getBeanNamesForType(MonitorRunner.class)).isEmpty();
    }

    @Test
    @DisplayName("no JMX endpoint exposure is configured while JMX stays off")
    void noJmxExposureConfigured() {
        var environment = context.getEnvironment();

        assertThat(environment.getProperty("spring.jmx.enabled", Boolean.class, false)).isFalse();
        assertThat(environment.containsProperty("management.endpoints.jmx.exposure.include")).isFalse();
    }
}
