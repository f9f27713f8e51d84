package com.healthwatch.statusapi.config;

import com.healthwatch.observability.MetricFactory;
import com.healthwatch.statusapi.domain.ReportStore;
import com.healthwatch.statusapi.infrastructure.store.InMemoryReportStore;
import com.healthwatch.statusapi.infrastructure.store.UnavailableReportStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link ReportStore} adapter and provides the clock and metric factory for the API.
 */
@Configuration
public class StatusApiConfig {

    private static final Logger log = LoggerFactory.getLogger(StatusApiConfig.class);

    @Bean
    public ReportStore reportStore(StatusApiProperties properties) {
        if (!properties.storeEnabled()) {
            log.warn("Report store disabled, all status requests will answer 503");
            return new UnavailableReportStore();
        }
        return new InMemoryReportStore();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, StatusApiProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
