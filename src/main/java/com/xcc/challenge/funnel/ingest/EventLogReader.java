package com.xcc.challenge.funnel.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xcc.challenge.funnel.exception.InputReadException;
import com.xcc.challenge.funnel.model.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the raw event log: a JSON array of event records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLogReader {

    private static final TypeReference<List<RawEvent>> RAW_EVENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * @param path event log file
     * @return records in file order
     * @throws InputReadException if the file is missing, unreadable or not a JSON array of records
     */
    public List<RawEvent> read(Path path) {
        log.info("Reading event log from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            List<RawEvent> records = objectMapper.readValue(in, RAW_EVENT_LIST);
            if (records == null) {
                throw new InputReadException("Event log " + path + " contains no JSON array", null);
            }
            log.info("Read {} raw events from {}", records.size(), path);
            return records;
        } catch (NoSuchFileException e) {
            throw new InputReadException("Event log not found: " + path, e);
        } catch (JsonProcessingException e) {
            throw new InputReadException("Invalid JSON in event log " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InputReadException("Failed to read event log " + path, e);
        }
    }
}
