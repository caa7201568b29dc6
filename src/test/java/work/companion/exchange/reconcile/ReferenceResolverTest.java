package work.companion.exchange.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.companion.exchange.support.StoreFixtures.resource;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.store.SqliteStoreGateway;
import work.companion.exchange.support.LogCapture;
import work.companion.exchange.support.StoreFixtures;

class ReferenceResolverTest {
    private SqliteStoreGateway store;

    @BeforeEach
    void openStore() {
        store = StoreFixtures.memoryStore();
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void resolvesNamesAndPassesIdsThrough() {
        var water = resource(store, "Water", "Liquid");

        var resolution = new ReferenceResolver(store).resolve("Stillsuit", List.of(
            IngredientRef.byName("Water", 4),
            IngredientRef.byId(77, 1)
        ));

        assertEquals(List.of(new IngredientLink(water.id(), 4), new IngredientLink(77, 1)), resolution.links());
        assertTrue(resolution.warnings().isEmpty());
    }

    @Test
    void prefersSuppliedIdOverName() {
        var water = resource(store, "Water", "Liquid");

        var resolution = new ReferenceResolver(store).resolve("Stillsuit", List.of(
            new IngredientRef(Optional.of(water.id()), Optional.of("Eau"), Optional.of(2))
        ));

        assertEquals(List.of(new IngredientLink(water.id(), 2)), resolution.links());
        assertTrue(resolution.warnings().isEmpty());
    }

    @Test
    void dropsUnresolvableIngredientsWithOneWarningEach() {
        var water = resource(store, "Water", "Liquid");

        try (var logs = LogCapture.of(ReferenceResolver.class)) {
            var resolution = new ReferenceResolver(store).resolve("Stillsuit", List.of(
                IngredientRef.byName("Ghost Dust", 1),
                IngredientRef.byName("Water", 0),
                new IngredientRef(Optional.empty(), Optional.of("Water"), Optional.empty()),
                IngredientRef.byName("Water", 2),
                IngredientRef.byId(water.id(), 3)
            ));

            assertEquals(List.of(new IngredientLink(water.id(), 2)), resolution.links());
            assertEquals(4, resolution.warnings().size());
            assertEquals(resolution.warnings(), logs.warnings());
            assertTrue(resolution.warnings().get(0).contains("Ghost Dust"));
        }
    }
}
