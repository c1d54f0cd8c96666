package floodgate.adapter.out.serialization;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.RateLimitEvent;
import floodgate.core.port.out.EventExporter;

/**
 * Serializes recorded events as a JSON array or as CSV with a header row.
 */
@ApplicationScoped
public class JsonCsvEventExporter implements EventExporter {

    static final String CSV_HEADER =
            "timestamp,identifier,scope,rule,endpoint,api_provider,allowed,limit,remaining,retry_after";

    private final ObjectMapper objectMapper;

    @Inject
    public JsonCsvEventExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String export(List<RateLimitEvent> events, ExportFormat format) {
        return switch (format) {
            case JSON -> toJson(events);
            case CSV -> toCsv(events);
        };
    }

    private String toJson(List<RateLimitEvent> events) {
        final var array = objectMapper.createArrayNode();
        for (final var event : events) {
            final var node = array.addObject();
            node.put("timestamp", event.timestamp().toString());
            node.put("identifier", event.identifier());
            node.put("scope", event.scope());
            node.put("rule", event.ruleName());
            node.put("endpoint", event.endpoint().orElse(null));
            node.put("apiProvider", event.apiProvider().orElse(null));
            node.put("allowed", event.allowed());
            node.put("limit", event.limit());
            node.put("remaining", event.remaining());
            node.put("retryAfter", event.retryAfter().orElse(null));
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize events", e);
        }
    }

    private String toCsv(List<RateLimitEvent> events) {
        final var csv = new StringBuilder(CSV_HEADER).append('\n');
        for (final var event : events) {
            csv.append(event.timestamp()).append(',')
                    .append(escape(event.identifier())).append(',')
                    .append(escape(event.scope())).append(',')
                    .append(escape(event.ruleName())).append(',')
                    .append(escape(event.endpoint().orElse(""))).append(',')
                    .append(escape(event.apiProvider().orElse(""))).append(',')
                    .append(event.allowed()).append(',')
                    .append(event.limit()).append(',')
                    .append(event.remaining()).append(',')
                    .append(event.retryAfter().map(String::valueOf).orElse(""))
                    .append('\n');
        }
        return csv.toString();
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
