package work.companion.exchange.shared;

import java.util.Locale;
import java.util.Optional;

/**
 * Lenient conversions for scalar values read from external documents.
 */
public final class TextValues {
    private TextValues() {}

    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public static Optional<Integer> parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return parseWholeDecimal(raw.trim());
        }
    }

    // accepts "3.0" as written by spreadsheets
    private static Optional<Integer> parseWholeDecimal(String raw) {
        try {
            double value = Double.parseDouble(raw);
            if (value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE) {
                return Optional.of((int) value);
            }
            return Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static Optional<Long> parseLong(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /** Reads the leading integer token of values such as {@code "30 seconds"}. */
    public static Optional<Integer> parseLeadingInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String token = raw.strip().split("\\s+", 2)[0];
        int end = 0;
        while (end < token.length() && Character.isDigit(token.charAt(end))) {
            end++;
        }
        return end == 0 ? Optional.empty() : parseInt(token.substring(0, end));
    }

    public static Optional<Boolean> parseFlag(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "y", "x" -> Optional.of(true);
            case "0", "false", "no", "n", "-" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    /** Collapses line breaks so a value stays on a single Markdown bullet. */
    public static String singleLine(String value) {
        return value == null ? "" : value.replaceAll("\\s*\\R\\s*", " ").strip();
    }
}
