package com.healthwatch.monitoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MonitoredApplication")
class MonitoredApplicationTest {

    @Test
    @DisplayName("defaults to rbcapp1 with httpd, rabbitmq and postgresql")
    void defaults() {
        var app = MonitoredApplication.defaults();

        assertThat(app.name()).isEqualTo("rbcapp1");
        assertThat(app.dependencies()).containsExactly("httpd", "rabbitmq", "postgresql");
    }

    @Test
    @DisplayName("copies the dependency list")
    void copiesDependencies() {
        List<String> deps = new ArrayList<>(List.of("redis"));
        var app = new MonitoredApplication("shop", deps);

        deps.add("nginx");

        assertThat(app.dependencies()).containsExactly("redis");
    }

    @Test
    @DisplayName("rejects blank name, empty list and blank entries")
    void rejectsInvalid() {
        assertThatThrownBy(() -> new MonitoredApplication(" ", List.of("redis")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MonitoredApplication("shop", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MonitoredApplication("shop", Arrays.asList("redis", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
