package com.xcc.challenge.funnel.ingest;

import com.xcc.challenge.funnel.config.JacksonConfig;
import com.xcc.challenge.funnel.exception.InputReadException;
import com.xcc.challenge.funnel.model.RawEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.xcc.challenge.funnel.testutil.TestFactory.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EventLogReaderTest {

    private final EventLogReader reader = new EventLogReader(JacksonConfig.newObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void testReadsRecordsInFileOrder() {
        List<RawEvent> records = reader.read(fixture("sample-events.json"));

        assertThat(records).hasSize(12);
        RawEvent first = records.get(0);
        assertThat(first.getId()).isEqualTo("a3");
        assertThat(first.getType()).isEqualTo("view");
        assertThat(first.getEvent().getCustomerId()).isEqualTo("A");
        assertThat(first.getEvent().getTimestamp()).isEqualTo("2023-03-01T11:23:20Z");
    }

    /**
     * Numeric customer ids are read as text; unknown properties are ignored.
     */
    @Test
    void testLenientFields() {
        List<RawEvent> records = reader.read(fixture("sample-events.json"));

        assertThat(records.get(1).getEvent().getCustomerId()).isEqualTo("42");
        assertThat(records.get(7).getId()).isEqualTo("a2");
    }

    @Test
    void testMissingAndNullCustomerBothReadAsNull() {
        List<RawEvent> records = reader.read(fixture("sample-events.json"));

        assertThat(records.get(4).getEvent().getCustomerId()).isNull();
        assertThat(records.get(8).getEvent().getCustomerId()).isNull();
    }

    @Test
    void testMissingFileFails() {
        Path missing = tempDir.resolve("nope.json");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(InputReadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testInvalidJsonFails() {
        assertThatThrownBy(() -> reader.read(fixture("invalid.json")))
                .isInstanceOf(InputReadException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void testNonArrayFails() throws Exception {
        Path file = tempDir.resolve("object.json");
        Files.writeString(file, "{\"id\": \"a1\"}");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(InputReadException.class);
    }

    @Test
    void testEmptyArray() throws Exception {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "[]");

        assertThat(reader.read(file)).isEmpty();
    }
}
