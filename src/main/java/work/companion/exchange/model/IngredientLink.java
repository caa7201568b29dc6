package work.companion.exchange.model;

/**
 * Resolved ingredient ready to be persisted for a recipe.
 */
public record IngredientLink(long resourceId, int quantity) {
    public IngredientLink {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
    }
}
