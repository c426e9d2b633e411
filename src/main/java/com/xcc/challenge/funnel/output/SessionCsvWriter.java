package com.xcc.challenge.funnel.output;

import com.xcc.challenge.funnel.exception.CsvExportException;
import com.xcc.challenge.funnel.model.SessionedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports the sessioned events table as CSV, same columns as the database table.
 * Disabled when no path is configured.
 */
@Slf4j
@Component
public class SessionCsvWriter {

    static final String HEADER = "id,type,customer-id,timestamp,time_diff,session";

    private final Path csvPath;

    public SessionCsvWriter(@Value("${output.csv.path:}") String csvPath) {
        this.csvPath = csvPath == null || csvPath.isBlank() ? null : Path.of(csvPath);
    }

    public boolean isEnabled() {
        return csvPath != null;
    }

    /**
     * Overwrite the CSV file with the given events. No-op when disabled.
     */
    public void write(List<SessionedEvent> events) {
        if (!isEnabled()) {
            return;
        }
        try {
            Path parent = csvPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter out = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8)) {
                out.write(HEADER);
                out.newLine();
                for (SessionedEvent event : events) {
                    out.write(String.join(",",
                            escape(event.id()),
                            escape(event.type()),
                            escape(event.customerId()),
                            event.timestamp().toString(),
                            Double.toString(event.timeDiff()),
                            Long.toString(event.sessionId())));
                    out.newLine();
                }
            }
            log.info("Exported {} sessioned events to {}", events.size(), csvPath);
        } catch (IOException e) {
            log.error("Failed to export sessioned events to {}", csvPath, e);
            throw new CsvExportException("CSV export to " + csvPath + " failed", e);
        }
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
