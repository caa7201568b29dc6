package work.companion.exchange.shared;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code "3x Iron Ingot"} convention used for recipe outputs and ingredients. A value
 * without a numeric multiplier is taken as a name with quantity 1.
 */
public record QuantityPrefix(int quantity, String name) {
    private static final Pattern MULTIPLIER = Pattern.compile("^(\\d{1,9})\\s*[xX×]\\s*(.*)$");

    public static QuantityPrefix parse(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        Matcher matcher = MULTIPLIER.matcher(trimmed);
        if (matcher.matches()) {
            return new QuantityPrefix(Integer.parseInt(matcher.group(1)), matcher.group(2).strip());
        }
        return new QuantityPrefix(1, trimmed);
    }

    public String render() {
        return quantity + "x " + name;
    }
}
