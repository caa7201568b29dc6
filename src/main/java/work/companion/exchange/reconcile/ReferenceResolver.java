package work.companion.exchange.reconcile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.Resource;
import work.companion.exchange.store.StoreGateway;

/**
 * Turns the ingredient references of an imported recipe into links to stored resources.
 *
 * <p>References carrying a resource id are passed through, even when they also carry a name; the
 * store's foreign key check rejects unknown ids when the recipe is written. References with only a
 * name are looked up, and an unknown name drops that ingredient only. Missing or non-positive quantities and repeated resources are dropped too.
 * Every drop is logged and reported back as a warning.
 */
public final class ReferenceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private final StoreGateway store;

    public ReferenceResolver(StoreGateway store) {
        this.store = store;
    }

    public record Resolution(List<IngredientLink> links, List<String> warnings) {
        public Resolution {
            links = List.copyOf(links);
            warnings = List.copyOf(warnings);
        }
    }

    public Resolution resolve(String recipeName, List<IngredientRef> ingredients) {
        List<IngredientLink> links = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<Long> linked = new HashSet<>();
        for (IngredientRef ingredient : ingredients) {
            Optional<Integer> quantity = ingredient.quantity().filter(q -> q > 0);
            if (quantity.isEmpty()) {
                warn(warnings, "Dropping ingredient '" + ingredient.describe() + "' of recipe '" + recipeName
                    + "': quantity must be a positive number");
                continue;
            }
            Optional<Long> resourceId = ingredient.resourceId().isPresent()
                ? ingredient.resourceId()
                : ingredient.resourceName().flatMap(store::findResourceByName).map(Resource::id);
            if (resourceId.isEmpty()) {
                warn(warnings, "Resource '" + ingredient.resourceName().orElse("?") + "' not found for recipe '"
                    + recipeName + "'; ingredient dropped");
                continue;
            }
            if (!linked.add(resourceId.get())) {
                warn(warnings, "Dropping duplicate ingredient '" + ingredient.describe() + "' of recipe '"
                    + recipeName + "'");
                continue;
            }
            links.add(new IngredientLink(resourceId.get(), quantity.get()));
        }
        return new Resolution(links, warnings);
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }
}
