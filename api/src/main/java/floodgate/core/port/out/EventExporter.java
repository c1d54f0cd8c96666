package floodgate.core.port.out;

import java.util.List;

import floodgate.core.model.monitor.ExportFormat;
import floodgate.core.model.monitor.RateLimitEvent;

/**
 * Port interface for serializing recorded decision events.
 */
public interface EventExporter {

    /**
     * @param events the events to export, oldest first
     * @param format target format
     * @return the serialized events
     */
    String export(List<RateLimitEvent> events, ExportFormat format);
}
