package work.companion.exchange.support;

import java.util.List;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.store.SqliteStoreGateway;
import work.companion.exchange.store.StoreGateway;

/**
 * Shared helpers to seed an in-memory store for the exchange test suites.
 */
public final class StoreFixtures {
    private StoreFixtures() {}

    public static SqliteStoreGateway memoryStore() {
        return SqliteStoreGateway.openInMemory();
    }

    public static Resource resource(StoreGateway store, String name, String category) {
        return store.createResource(ResourceRecord.builder()
            .name(name)
            .category(category)
            .rarity("Common")
            .build());
    }

    public static CraftingRecipe recipe(StoreGateway store, String name, String outputItem, IngredientLink... ingredients) {
        return store.createRecipe(
            RecipeRecord.builder()
                .name(name)
                .outputItemName(outputItem)
                .outputQuantity(1)
                .requiredStation("Fabricator")
                .build(),
            List.of(ingredients)
        );
    }

    public static IngredientLink link(Resource resource, int quantity) {
        return new IngredientLink(resource.id(), quantity);
    }

    /** Ingredients of a stored recipe rendered as {@code "Name:quantity"}. */
    public static List<String> ingredientSummary(CraftingRecipe recipe) {
        return recipe.ingredients().stream()
            .map(ingredient -> ingredient.resourceName() + ":" + ingredient.quantity())
            .toList();
    }
}
