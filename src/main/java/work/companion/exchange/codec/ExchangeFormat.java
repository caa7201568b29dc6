package work.companion.exchange.codec;

import java.util.Locale;

/**
 * Supported exchange document formats.
 */
public enum ExchangeFormat {
    JSON,
    MARKDOWN,
    CSV;

    public static ExchangeFormat from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Export format is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "json" -> JSON;
            case "markdown", "md" -> MARKDOWN;
            case "csv" -> CSV;
            default -> throw new IllegalArgumentException("Unsupported format: " + value);
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
