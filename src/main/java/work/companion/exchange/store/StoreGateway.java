package work.companion.exchange.store;

import java.util.List;
import java.util.Optional;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;

/**
 * Persistence boundary used by the exchange pipelines.
 *
 * <p>Implementations enforce unique names (reported as {@link StoreException.Kind#DUPLICATE_NAME}),
 * reject ingredient links to unknown resources ({@link StoreException.Kind#MISSING_REFERENCE}) and
 * cascade-delete ingredients when their recipe or resource goes away. Every mutating call is atomic
 * on its own; {@link #inTransaction(StoreWork)} groups several calls into one commit.
 */
public interface StoreGateway extends AutoCloseable {
    Optional<Resource> findResourceByName(String name);

    List<Resource> listResources();

    Resource createResource(ResourceRecord record);

    /** Applies the fields present in {@code patch}; absent fields are left untouched. */
    Resource updateResource(long id, ResourceRecord patch);

    /**
     * Rewrites every scalar field from {@code record}; absent fields revert to their defaults and both
     * timestamps restart. The id is kept so ingredient rows pointing at it survive.
     */
    Resource overwriteResource(long id, ResourceRecord record);

    boolean deleteResource(long id);

    Optional<CraftingRecipe> findRecipeByName(String name);

    List<CraftingRecipe> listRecipes();

    CraftingRecipe createRecipe(RecipeRecord record, List<IngredientLink> ingredients);

    /**
     * Applies the scalar fields present in {@code patch}. A present {@code ingredients} list replaces
     * the stored ingredients as a whole.
     */
    CraftingRecipe updateRecipe(long id, RecipeRecord patch, Optional<List<IngredientLink>> ingredients);

    boolean deleteRecipe(long id);

    <T> T inTransaction(StoreWork<T> work);

    @Override
    void close();
}
