package work.companion.exchange.reconcile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.reconcile.RecordOutcome.Action;
import work.companion.exchange.store.StoreException;
import work.companion.exchange.store.StoreGateway;

/**
 * Merges decoded records into the store, one record at a time.
 *
 * <p>Records are keyed by name. Each create, update or replace runs in its own store transaction, so
 * a rejected record leaves nothing behind and the rest of the batch carries on. When a batch holds
 * the same name more than once, only the last occurrence is applied.
 */
public final class ReconciliationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationEngine.class);
    private static final String NO_CHANGES = "No fields supplied";

    private final StoreGateway store;

    public ReconciliationEngine(StoreGateway store) {
        this.store = store;
    }

    public List<RecordOutcome> reconcileResources(List<ResourceRecord> records, MergeStrategy strategy) {
        return reconcile(EntityKind.RESOURCE, records, ResourceRecord::name, record -> applyResource(record, strategy));
    }

    public List<RecordOutcome> reconcileRecipes(List<RecipeRecord> records, MergeStrategy strategy) {
        return reconcile(EntityKind.RECIPE, records, RecipeRecord::name, record -> applyRecipe(record, strategy));
    }

    private <R> List<RecordOutcome> reconcile(
        EntityKind kind,
        List<R> records,
        Function<R, String> nameOf,
        Function<R, RecordOutcome> apply
    ) {
        Map<String, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            String name = normalizeName(nameOf.apply(records.get(i)));
            if (name != null) {
                lastIndex.put(name, i);
            }
        }
        List<RecordOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            R record = records.get(i);
            String name = normalizeName(nameOf.apply(record));
            RecordOutcome outcome;
            if (name == null) {
                outcome = RecordOutcome.failed(kind, nameOf.apply(record), "Missing " + kind.label() + " name");
            } else if (lastIndex.get(name) != i) {
                outcome = RecordOutcome.skipped(kind, name, "Superseded by a later record with the same name");
            } else {
                outcome = applySafely(kind, name, record, apply);
            }
            log(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private <R> RecordOutcome applySafely(EntityKind kind, String name, R record, Function<R, RecordOutcome> apply) {
        try {
            return apply.apply(record);
        } catch (RecordException ex) {
            return RecordOutcome.failed(kind, name, ex.getMessage());
        } catch (StoreException ex) {
            return RecordOutcome.failed(kind, name, describe(ex));
        }
    }

    private RecordOutcome applyResource(ResourceRecord incoming, MergeStrategy strategy) {
        ResourceRecord record = incoming.toBuilder().name(normalizeName(incoming.name())).build();
        String name = record.name();
        return store.inTransaction(tx -> {
            Optional<Resource> existing = tx.findResourceByName(name);
            if (existing.isEmpty()) {
                tx.createResource(record);
                return RecordOutcome.of(EntityKind.RESOURCE, name, Action.CREATED, List.of());
            }
            long id = existing.get().id();
            return switch (strategy) {
                case SKIP -> RecordOutcome.skipped(EntityKind.RESOURCE, name, "Already exists");
                case UPDATE -> {
                    tx.updateResource(id, record);
                    yield record.hasScalarChanges()
                        ? RecordOutcome.of(EntityKind.RESOURCE, name, Action.UPDATED, List.of())
                        : new RecordOutcome(EntityKind.RESOURCE, name, Action.UPDATED, NO_CHANGES, List.of());
                }
                case REPLACE -> {
                    tx.overwriteResource(id, record);
                    yield RecordOutcome.of(EntityKind.RESOURCE, name, Action.REPLACED, List.of());
                }
            };
        });
    }

    private RecordOutcome applyRecipe(RecipeRecord incoming, MergeStrategy strategy) {
        RecipeRecord record = incoming.toBuilder().name(normalizeName(incoming.name())).build();
        String name = record.name();
        validateRecipe(record);
        return store.inTransaction(tx -> {
            Optional<CraftingRecipe> existing = tx.findRecipeByName(name);
            var resolver = new ReferenceResolver(tx);
            if (existing.isEmpty()) {
                requireOutputItem(record);
                var resolution = resolver.resolve(name, record.ingredients().orElse(List.of()));
                tx.createRecipe(record, resolution.links());
                return RecordOutcome.of(EntityKind.RECIPE, name, Action.CREATED, resolution.warnings());
            }
            long id = existing.get().id();
            switch (strategy) {
                case SKIP:
                    return RecordOutcome.skipped(EntityKind.RECIPE, name, "Already exists");
                case UPDATE: {
                    List<String> warnings = List.of();
                    Optional<List<IngredientLink>> links = Optional.empty();
                    if (record.ingredients().isPresent()) {
                        var resolution = resolver.resolve(name, record.ingredients().get());
                        links = Optional.of(resolution.links());
                        warnings = resolution.warnings();
                    }
                    tx.updateRecipe(id, record, links);
                    String reason = record.hasScalarChanges() || links.isPresent() ? null : NO_CHANGES;
                    return new RecordOutcome(EntityKind.RECIPE, name, Action.UPDATED, reason, warnings);
                }
                case REPLACE: {
                    requireOutputItem(record);
                    var resolution = resolver.resolve(name, record.ingredients().orElse(List.of()));
                    tx.deleteRecipe(id);
                    tx.createRecipe(record, resolution.links());
                    return RecordOutcome.of(EntityKind.RECIPE, name, Action.REPLACED, resolution.warnings());
                }
                default:
                    throw new IllegalStateException("Unhandled merge strategy: " + strategy);
            }
        });
    }

    private static void validateRecipe(RecipeRecord record) {
        record.outputQuantity().ifPresent(quantity -> {
            if (quantity < 1) {
                throw new RecordException("Output quantity of recipe '" + record.name() + "' must be at least 1, got " + quantity);
            }
        });
        record.outputItemName().ifPresent(item -> {
            if (item.isBlank()) {
                throw new RecordException("Output item name of recipe '" + record.name() + "' must not be blank");
            }
        });
    }

    private static void requireOutputItem(RecipeRecord record) {
        if (record.outputItemName().isEmpty()) {
            throw new RecordException("Recipe '" + record.name() + "' has no output item name");
        }
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.strip();
    }

    private static String describe(StoreException ex) {
        return switch (ex.kind()) {
            case DUPLICATE_NAME -> "Duplicate name: " + ex.getMessage();
            case MISSING_REFERENCE -> "Unknown resource reference: " + ex.getMessage();
            case NOT_FOUND -> "Entity vanished during import: " + ex.getMessage();
            case FAILURE -> ex.getMessage();
        };
    }

    private static void log(RecordOutcome outcome) {
        if (outcome.failed()) {
            LOG.warn("Failed to import {} '{}': {}", outcome.kind().label(), outcome.name(), outcome.reason());
        } else if (outcome.reason() != null) {
            LOG.info("{} {} '{}': {}", outcome.action(), outcome.kind().label(), outcome.name(), outcome.reason());
        } else {
            LOG.info("{} {} '{}'", outcome.action(), outcome.kind().label(), outcome.name());
        }
    }
}
