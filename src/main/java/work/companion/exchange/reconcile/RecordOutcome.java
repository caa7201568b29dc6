package work.companion.exchange.reconcile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.companion.exchange.model.EntityKind;

/**
 * Result of reconciling one imported record.
 */
public record RecordOutcome(EntityKind kind, String name, Action action, String reason, List<String> warnings) {
    public enum Action {
        CREATED,
        UPDATED,
        REPLACED,
        SKIPPED,
        FAILED
    }

    public RecordOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(action, "action");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RecordOutcome of(EntityKind kind, String name, Action action, List<String> warnings) {
        return new RecordOutcome(kind, name, action, null, warnings);
    }

    public static RecordOutcome skipped(EntityKind kind, String name, String reason) {
        return new RecordOutcome(kind, name, Action.SKIPPED, reason, List.of());
    }

    public static RecordOutcome failed(EntityKind kind, String name, String reason) {
        return new RecordOutcome(kind, name, Action.FAILED, reason, List.of());
    }

    public boolean failed() {
        return action == Action.FAILED;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("kind", kind.name().toLowerCase(Locale.ROOT));
        serializable.put("name", name);
        serializable.put("action", action.name().toLowerCase(Locale.ROOT));
        if (reason != null) {
            serializable.put("reason", reason);
        }
        if (!warnings.isEmpty()) {
            serializable.put("warnings", warnings);
        }
        return serializable;
    }
}
