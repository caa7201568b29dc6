package work.companion.exchange.api;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import work.companion.exchange.model.EntityKind;

/**
 * Which entity kinds an export covers.
 */
public enum EntityScope {
    ALL(EnumSet.allOf(EntityKind.class)),
    RESOURCES(EnumSet.of(EntityKind.RESOURCE)),
    RECIPES(EnumSet.of(EntityKind.RECIPE));

    private final Set<EntityKind> kinds;

    EntityScope(Set<EntityKind> kinds) {
        this.kinds = kinds;
    }

    public Set<EntityKind> kinds() {
        return EnumSet.copyOf(kinds);
    }

    public static EntityScope from(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> ALL;
            case "resources", "resource" -> RESOURCES;
            case "recipes", "recipe", "crafting_recipes" -> RECIPES;
            default -> throw new IllegalArgumentException("Unsupported export scope: " + value);
        };
    }
}
