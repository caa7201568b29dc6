package work.companion.exchange.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.ExportMetadata;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;

class MarkdownDocumentCodecTest {
    private final MarkdownDocumentCodec codec = new MarkdownDocumentCodec();

    @Test
    void decodesBoldKeyBullets() {
        var markdown = """
            ## Resources
            ### Water
            - **Category:** Material
            - **Rarity:** Common
            """;

        var batch = codec.decode(markdown);

        assertEquals(1, batch.resources().size());
        var water = batch.resources().get(0);
        assertEquals("Water", water.name());
        assertEquals(Optional.of("Material"), water.category());
        assertEquals(Optional.of("Common"), water.rarity());
        assertEquals(Optional.empty(), water.description());
        assertTrue(batch.recipes().isEmpty());
    }

    @Test
    void parsesIngredientMultipliers() {
        var markdown = """
            ## Crafting Recipes
            ### Spice Coffee
            - **Output:** Spice Coffee
            - Ingredient: 3x Iron Ingot
            - Ingredient: Spice
            """;

        var recipe = codec.decode(markdown).recipes().get(0);

        assertEquals(
            List.of(IngredientRef.byName("Iron Ingot", 3), IngredientRef.byName("Spice", 1)),
            recipe.ingredients().orElseThrow()
        );
        assertEquals(Optional.of(1), recipe.outputQuantity());
    }

    @Test
    void readsBackWhatItWrites() {
        var resource = ResourceRecord.builder()
            .name("Iron Ingot")
            .category("Metal")
            .rarity("Common*")
            .description("Smelted from\niron ore")
            .iconPath("icons/iron_ingot_")
            .discovered(false)
            .build();
        var recipe = RecipeRecord.builder()
            .name("Stillsuit Mk2")
            .outputItemName("Stillsuit")
            .outputQuantity(2)
            .craftingTimeSeconds(45)
            .requiredStation("Fabricator")
            .skillRequirement("_Survival_")
            .discovered(true)
            .ingredients(List.of(IngredientRef.byName("Iron Ingot", 3)))
            .build();
        var batch = RecordBatch.of(List.of(resource), List.of(recipe))
            .withMetadata(new ExportMetadata("2024-05-01T10:15:30Z", "0.1.0", 1, 1));

        String markdown = codec.encode(batch, EnumSet.allOf(EntityKind.class));
        var decoded = codec.decode(markdown);

        assertTrue(markdown.contains("- **Output:** 2x Stillsuit"));
        assertTrue(markdown.contains("- **Time:** 45 seconds"));
        assertTrue(markdown.contains("- Ingredient: 3x Iron Ingot"));
        assertEquals(resource.toBuilder().description("Smelted from iron ore").build(), decoded.resources().get(0));
        assertEquals(recipe, decoded.recipes().get(0));
    }

    @Test
    void ignoresEntitiesOutsideKnownSections() {
        var markdown = """
            # Dune Companion Data Export
            ## Export Information
            - **Export Date:** 2024-05-01
            ### Stray
            - **Category:** Nothing
            ## Resources
            ### Sand
            """;

        var batch = codec.decode(markdown);

        assertEquals(List.of("Sand"), batch.resources().stream().map(ResourceRecord::name).toList());
    }

    @Test
    void rejectsDocumentsWithoutRecords() {
        assertThrows(CodecException.class, () -> codec.decode("# Notes\n\nNothing to import here.\n"));
    }
}
