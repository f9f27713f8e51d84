package com.healthwatch.statusapi;

import com.healthwatch.statusapi.config.StatusApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Healthwatch status API: ingests status records and answers "what is the latest status" queries.
 *
 * <ul>
 *   <li>{@code POST /add} stores one record
 *   <li>{@code GET /healthcheck} returns the latest status of every known service
 *   <li>{@code GET /healthcheck/{serviceName}} returns the latest record of one service
 * </ul>
 *
 * <p>Records are kept in a {@link com.healthwatch.statusapi.domain.ReportStore}; the bundled
 * adapter is in-memory.
 */
@SpringBootApplication
@EnableConfigurationProperties(StatusApiProperties.class)
public class StatusApiApplication {

    private static final Logger log = LoggerFactory.getLogger(StatusApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(StatusApiApplication.class, args);
        log.info("Healthwatch Status API started successfully");
    }
}
