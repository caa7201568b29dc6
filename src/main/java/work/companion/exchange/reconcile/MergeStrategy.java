package work.companion.exchange.reconcile;

import java.util.Locale;

/**
 * How an imported record is merged into an entity that already exists under the same name.
 */
public enum MergeStrategy {
    /** Apply only the fields present in the record. */
    UPDATE,
    /** The record fully replaces the stored entity; absent fields revert to defaults. */
    REPLACE,
    /** Leave existing entities untouched. */
    SKIP;

    public static MergeStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return UPDATE;
        }
        try {
            return MergeStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported merge strategy: " + value);
        }
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
