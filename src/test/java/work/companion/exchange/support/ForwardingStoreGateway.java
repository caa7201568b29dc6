package work.companion.exchange.support;

import java.util.List;
import java.util.Optional;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.store.StoreGateway;
import work.companion.exchange.store.StoreWork;

/**
 * Delegates every call; tests override single operations to inject failures.
 */
public class ForwardingStoreGateway implements StoreGateway {
    private final StoreGateway delegate;

    public ForwardingStoreGateway(StoreGateway delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Resource> findResourceByName(String name) {
        return delegate.findResourceByName(name);
    }

    @Override
    public List<Resource> listResources() {
        return delegate.listResources();
    }

    @Override
    public Resource createResource(ResourceRecord record) {
        return delegate.createResource(record);
    }

    @Override
    public Resource updateResource(long id, ResourceRecord patch) {
        return delegate.updateResource(id, patch);
    }

    @Override
    public Resource overwriteResource(long id, ResourceRecord record) {
        return delegate.overwriteResource(id, record);
    }

    @Override
    public boolean deleteResource(long id) {
        return delegate.deleteResource(id);
    }

    @Override
    public Optional<CraftingRecipe> findRecipeByName(String name) {
        return delegate.findRecipeByName(name);
    }

    @Override
    public List<CraftingRecipe> listRecipes() {
        return delegate.listRecipes();
    }

    @Override
    public CraftingRecipe createRecipe(RecipeRecord record, List<IngredientLink> ingredients) {
        return delegate.createRecipe(record, ingredients);
    }

    @Override
    public CraftingRecipe updateRecipe(long id, RecipeRecord patch, Optional<List<IngredientLink>> ingredients) {
        return delegate.updateRecipe(id, patch, ingredients);
    }

    @Override
    public boolean deleteRecipe(long id) {
        return delegate.deleteRecipe(id);
    }

    @Override
    public <T> T inTransaction(StoreWork<T> work) {
        return delegate.inTransaction(ignored -> work.run(this));
    }

    @Override
    public void close() {
        delegate.close();
    }
}
