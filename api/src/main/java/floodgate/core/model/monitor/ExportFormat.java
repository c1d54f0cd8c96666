package floodgate.core.model.monitor;

import java.util.Locale;

/**
 * Serialization formats for exports.
 */
public enum ExportFormat {
    JSON,
    CSV;

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value);
        }
    }
}
