package work.companion.exchange.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Crafting recipe as persisted by the store, together with its owned, ordered ingredients.
 */
public record CraftingRecipe(
    long id,
    String name,
    String description,
    String outputItemName,
    int outputQuantity,
    Integer craftingTimeSeconds,
    String requiredStation,
    String skillRequirement,
    String iconPath,
    boolean discovered,
    List<Ingredient> ingredients,
    String createdAt,
    String updatedAt
) {
    public CraftingRecipe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outputItemName, "outputItemName");
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
    }

    /**
     * Canonical form used for export. Ingredient references carry both the resource id and the
     * resource name read alongside the row.
     */
    public RecipeRecord toRecord() {
        var builder = RecipeRecord.builder()
            .id(id)
            .name(name)
            .description(description)
            .outputItemName(outputItemName)
            .outputQuantity(outputQuantity)
            .craftingTimeSeconds(craftingTimeSeconds)
            .requiredStation(requiredStation)
            .skillRequirement(skillRequirement)
            .iconPath(iconPath)
            .discovered(discovered)
            .ingredients(List.of())
            .createdAt(createdAt)
            .updatedAt(updatedAt);
        for (Ingredient ingredient : ingredients) {
            builder.addIngredient(new IngredientRef(
                Optional.of(ingredient.resourceId()),
                Optional.ofNullable(ingredient.resourceName()),
                Optional.of(ingredient.quantity())
            ));
        }
        return builder.build();
    }
}
