package work.companion.exchange.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Unresolved ingredient reference as it appears in an external document: either an already known
 * resource id or a resource name, plus the requested quantity.
 */
public record IngredientRef(Optional<Long> resourceId, Optional<String> resourceName, Optional<Integer> quantity) {
    public IngredientRef {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(resourceName, "resourceName");
        Objects.requireNonNull(quantity, "quantity");
    }

    public static IngredientRef byName(String resourceName, int quantity) {
        return new IngredientRef(Optional.empty(), Optional.ofNullable(resourceName), Optional.of(quantity));
    }

    public static IngredientRef byId(long resourceId, int quantity) {
        return new IngredientRef(Optional.of(resourceId), Optional.empty(), Optional.of(quantity));
    }

    public String describe() {
        String target = resourceName.orElseGet(() -> resourceId.map(id -> "#" + id).orElse("?"));
        return quantity.map(q -> q + "x " + target).orElse(target);
    }
}
