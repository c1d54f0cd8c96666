package floodgate.adapter.out.serialization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.RateLimitEvent;

@DisplayName("JsonCsvEventExporter")
class JsonCsvEventExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonCsvEventExporter exporter = new JsonCsvEventExporter(objectMapper);

    private final List<RateLimitEvent> events = List.of(
            new RateLimitEvent(
                    Instant.parse("2024-05-01T12:00:00Z"), "user:a", "endpoint:/api/**", "rps",
                    Optional.of("/api/search,v2"), Optional.of("openai"), false, 10, 0, Optional.of(3L)),
            new RateLimitEvent(
                    Instant.parse("2024-05-01T12:00:01Z"), "user:b", "global", "rps",
                    Optional.empty(), Optional.empty(), true, 10, 9, Optional.empty()));

    @Test
    @DisplayName("CSV should have a header and quote fields with commas")
    void csvShouldQuoteFields() {
        var lines = exporter.export(events, ExportFormat.CSV).split("\n");

        assertEquals(JsonCsvEventExporter.CSV_HEADER, lines[0]);
        assertEquals(
                "2024-05-01T12:00:00Z,user:a,endpoint:/api/**,rps,\"/api/search,v2\",openai,false,10,0,3", lines[1]);
        assertEquals("2024-05-01T12:00:01Z,user:b,global,rps,,,true,10,9,", lines[2]);
    }

    @Test
    @DisplayName("JSON should write one object per event")
    void jsonShouldWriteObjects() throws Exception {
        var tree = objectMapper.readTree(exporter.export(events, ExportFormat.JSON));

        assertEquals(2, tree.size());
        assertEquals("user:a", tree.get(0).get("identifier").asText());
        assertEquals(3, tree.get(0).get("retryAfter").asLong());
        assertTrue(tree.get(1).get("endpoint").isNull());
    }

    @Test
    @DisplayName("should escape embedded quotes")
    void shouldEscapeQuotes() {
        assertEquals("\"say \"\"hi\"\"\"", JsonCsvEventExporter.escape("say \"hi\""));
        assertEquals("plain", JsonCsvEventExporter.escape("plain"));
    }
}
