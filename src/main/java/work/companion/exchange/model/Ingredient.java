package work.companion.exchange.model;

/**
 * Persisted ingredient row. {@code resourceName} is joined from the current resource when the row is
 * read and is never stored.
 */
public record Ingredient(long id, long recipeId, long resourceId, int quantity, int position, String resourceName) {}
