package com.healthwatch.statusmonitor.runner;

import com.healthwatch.statusmodel.HealthStatus;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Prints the human-readable summary of a monitoring pass.
 */
@Component
public class MonitoringSummaryPrinter {

    private static final String RULE = "=".repeat(50);

    private final PrintStream out;

    public MonitoringSummaryPrinter() {
        this(System.out);
    }

    public MonitoringSummaryPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(MonitoringSummary summary) {
        out.println();
        out.println(RULE);
        out.println("MONITORING SUMMARY");
        out.println(RULE);
        out.println("Timestamp: " + orUnknown(summary.timestamp()));
        out.println("Hostname: " + orUnknown(summary.hostName()));
        out.println();

        if (!summary.statuses().isEmpty()) {
            out.println("Service Statuses:");
            for (Map.Entry<String, HealthStatus> entry : summary.statuses().entrySet()) {
                out.println("  " + symbol(entry.getValue()) + " " + entry.getKey() + ": " + entry.getValue());
            }
            out.println();
        }

        if (summary.applicationStatus() != null) {
            out.println("Application Status:");
            out.println("  " + symbol(summary.applicationStatus()) + " " + summary.applicationName()
                    + ": " + summary.applicationStatus());
            out.println();
        }

        if (!summary.writtenFiles().isEmpty()) {
            out.println("Status Files Written:");
            for (Path file : summary.writtenFiles()) {
                out.println("  - " + file);
            }
            out.println();
        }

        if (summary.error() != null) {
            printError(summary.error());
            out.println();
        }

        out.println(RULE);
        out.flush();
    }

    public void printError(String message) {
        out.println("Error: " + message);
        out.flush();
    }

    private static String symbol(HealthStatus status) {
        return status.isUp() ? "✓" : "✗";
    }

    private static String orUnknown(String value) {
        return value != null ? value : "Unknown";
    }
}
