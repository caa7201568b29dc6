package work.companion.exchange.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.companion.exchange.support.StoreFixtures.ingredientSummary;
import static work.companion.exchange.support.StoreFixtures.link;
import static work.companion.exchange.support.StoreFixtures.recipe;
import static work.companion.exchange.support.StoreFixtures.resource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.support.StoreFixtures;

class SqliteStoreGatewayTest {
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
    void createsAndFindsResourcesByName() {
        var created = store.createResource(ResourceRecord.builder()
            .name("Spice Melange")
            .category("Raw")
            .rarity("Rare")
            .sourceLocations("Deep desert")
            .discovered(true)
            .build());

        var found = store.findResourceByName("Spice Melange").orElseThrow();
        assertEquals(created.id(), found.id());
        assertEquals("Raw", found.category());
        assertEquals("Deep desert", found.sourceLocations());
        assertTrue(found.discovered());
        assertNull(found.description());
        assertEquals(found.createdAt(), found.updatedAt());
        assertTrue(store.findResourceByName("Water").isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        resource(store, "Water", "Liquid");
        var ex = assertThrows(StoreException.class, () -> resource(store, "Water", "Other"));
        assertEquals(StoreException.Kind.DUPLICATE_NAME, ex.kind());
    }

    @Test
    void keepsIngredientOrderAndJoinsResourceNames() {
        var iron = resource(store, "Iron Ingot", "Metal");
        var water = resource(store, "Water", "Liquid");
        var created = recipe(store, "Stillsuit", "Stillsuit", link(water, 4), link(iron, 2));

        var loaded = store.findRecipeByName("Stillsuit").orElseThrow();
        assertEquals(created.id(), loaded.id());
        assertEquals(List.of("Water:4", "Iron Ingot:2"), ingredientSummary(loaded));
        assertEquals(List.of(0, 1), loaded.ingredients().stream().map(i -> i.position()).toList());
    }

    @Test
    void deletingResourceCascadesToIngredients() {
        var iron = resource(store, "Iron Ingot", "Metal");
        var water = resource(store, "Water", "Liquid");
        recipe(store, "Stillsuit", "Stillsuit", link(water, 4), link(iron, 2));

        assertTrue(store.deleteResource(water.id()));

        assertEquals(List.of("Iron Ingot:2"), ingredientSummary(store.findRecipeByName("Stillsuit").orElseThrow()));
    }

    @Test
    void unknownResourceIdLeavesNoRecipeBehind() {
        var ex = assertThrows(StoreException.class,
            () -> recipe(store, "Ghost Recipe", "Ghost", new IngredientLink(999, 1)));

        assertEquals(StoreException.Kind.MISSING_REFERENCE, ex.kind());
        assertTrue(store.findRecipeByName("Ghost Recipe").isEmpty());
    }

    @Test
    void patchUpdatesOnlyPresentFields() {
        var water = resource(store, "Water", "Liquid");

        var updated = store.updateResource(water.id(), ResourceRecord.builder().name("Water").description("Precious").build());

        assertEquals("Liquid", updated.category());
        assertEquals("Common", updated.rarity());
        assertEquals("Precious", updated.description());
    }

    @Test
    void overwriteResetsAbsentFieldsAndKeepsLinks() {
        var water = resource(store, "Water", "Liquid");
        recipe(store, "Stillsuit", "Stillsuit", link(water, 4));

        var overwritten = store.overwriteResource(water.id(), ResourceRecord.builder().name("Water").rarity("Uncommon").build());

        assertEquals(water.id(), overwritten.id());
        assertNull(overwritten.category());
        assertEquals("Uncommon", overwritten.rarity());
        assertEquals(List.of("Water:4"), ingredientSummary(store.findRecipeByName("Stillsuit").orElseThrow()));
    }

    @Test
    void updateRecipeReplacesIngredientsAsAWhole() {
        var a = resource(store, "A", "Test");
        var b = resource(store, "B", "Test");
        var stored = recipe(store, "Widget", "Widget", link(a, 2));

        var updated = store.updateRecipe(stored.id(), RecipeRecord.builder().name("Widget").build(),
            Optional.of(List.of(link(b, 5))));

        assertEquals(List.of("B:5"), ingredientSummary(updated));
        assertEquals("Fabricator", updated.requiredStation());
    }

    @Test
    void transactionRollsBackEveryChangeOnFailure() {
        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            resource(tx, "Water", "Liquid");
            throw new IllegalStateException("boom");
        }));

        assertTrue(store.listResources().isEmpty());
        resource(store, "Water", "Liquid");
        assertEquals(1, store.listResources().size());
    }

    @Test
    void stampsTimestampsFromClockAndReopensFileStore(@TempDir Path tempDir) {
        var clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        Path file = tempDir.resolve("data").resolve("companion.db");
        try (var fileStore = SqliteStoreGateway.open(file, clock)) {
            resource(fileStore, "Water", "Liquid");
        }
        try (var reopened = SqliteStoreGateway.open(file)) {
            var water = reopened.findResourceByName("Water").orElseThrow();
            assertEquals("2024-05-01T10:15:30Z", water.createdAt());
            assertFalse(water.discovered());
        }
    }

    @Test
    void overwriteRestartsTimestamps(@TempDir Path tempDir) {
        Path file = tempDir.resolve("companion.db");
        var created = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        var replaced = Clock.fixed(Instant.parse("2024-06-02T08:00:00Z"), ZoneOffset.UTC);
        long id;
        try (var fileStore = SqliteStoreGateway.open(file, created)) {
            id = resource(fileStore, "Water", "Liquid").id();
        }
        try (var reopened = SqliteStoreGateway.open(file, replaced)) {
            var water = reopened.overwriteResource(id, ResourceRecord.builder().name("Water").build());

            assertEquals(id, water.id());
            assertEquals("2024-06-02T08:00:00Z", water.createdAt());
            assertEquals("2024-06-02T08:00:00Z", water.updatedAt());
        }
    }
}
