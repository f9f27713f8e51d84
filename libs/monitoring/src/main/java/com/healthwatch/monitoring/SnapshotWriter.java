package com.healthwatch.monitoring;

import com.healthwatch.statusmodel.StatusRecord;
import com.healthwatch.statusmodel.StatusRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists {@link StatusRecord} values as individual timestamped JSON files.
 * <p>
 * File name: {@code <name>-status-<timestamp>.json}, with {@code :} and {@code .} in the
 * timestamp replaced by {@code -}. Other characters are kept as they are. Two passes that
 * produce the same name and timestamp write the same file; the later write wins.
 */
public final class SnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    /** Directory used when none is given. */
    public static final String DEFAULT_DIRECTORY = "data";

    private final MonitoringMetrics metrics;

    public SnapshotWriter() {
        this(MonitoringMetrics.standalone());
    }

    public SnapshotWriter(MonitoringMetrics metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /**
     * Derives the snapshot file name for a service and timestamp.
     *
     * @throws IllegalArgumentException if the name is null or blank, or the timestamp is null
     */
    public static String fileNameFor(String name, String timestamp) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service_name must be a non-empty string");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        String safeTimestamp = timestamp.replace(':', '-').replace('.', '-');
        return name + "-status-" + safeTimestamp + ".json";
    }

    /**
     * Writes a record to the default directory.
     *
     * @see #write(StatusRecord, Path)
     */
    public Path write(StatusRecord record) {
        return write(record, Path.of(DEFAULT_DIRECTORY));
    }

    /**
     * Writes a record as an indented UTF-8 JSON file, creating the directory if needed.
     *
     * @return path of the written file
     * @throws IllegalArgumentException if the record or directory is null
     * @throws SnapshotWriteException   if the directory or file cannot be written, or the derived
     *                                  file name is not a valid path on this platform
     */
    public Path write(StatusRecord record, Path directory) {
        if (record == null) {
            throw new IllegalArgumentException("record must be a StatusRecord instance");
        }
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }

        try {
            Files.createDirectories(directory);
            Path file = directory.resolve(fileNameFor(record.name(), record.timestamp()));
            Files.writeString(file, StatusRecordSerializer.toPrettyJson(record), StandardCharsets.UTF_8);
            log.info("Successfully wrote status file: {}", file);
            return file;
        } catch (IOException | InvalidPathException e) {
            log.error("Failed to write status file for {}: {}", record.name(), e.toString());
            throw new SnapshotWriteException("Cannot write status file: " + e, record.name(), e);
        }
    }

    /**
     * Writes every record, skipping the ones that fail.
     *
     * @return paths of the files that were written, in input order
     * @throws IllegalArgumentException if the list or directory is null
     */
    public List<Path> writeAll(List<StatusRecord> records, Path directory) {
        return writeAllDetailed(records, directory).stream()
                .filter(WriteOutcome::succeeded)
                .map(WriteOutcome::path)
                .toList();
    }

    /**
     * Writes every record and reports a per-record outcome. A failure on one record does not
     * stop the others.
     *
     * @throws IllegalArgumentException if the list or directory is null
     */
    public List<WriteOutcome> writeAllDetailed(List<StatusRecord> records, Path directory) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }

        List<WriteOutcome> outcomes = new ArrayList<>(records.size());
        int failures = 0;
        for (StatusRecord record : records) {
            String name = record != null ? record.name() : "<null>";
            WriteOutcome outcome;
            try {
                outcome = WriteOutcome.written(name, write(record, directory));
            } catch (RuntimeException e) {
                log.error("Failed to write file for {}: {}", name, e.getMessage());
                outcome = WriteOutcome.failed(name, e.getMessage());
                failures++;
            }
            metrics.recordSnapshot(outcome);
            outcomes.add(outcome);
        }

        if (failures > 0) {
            log.warn("Encountered {} errors while writing status files", failures);
        }
        return outcomes;
    }
}
