package work.companion.exchange.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
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

class JsonDocumentCodecTest {
    private final JsonDocumentCodec codec = new JsonDocumentCodec();

    private static RecordBatch sampleBatch() {
        var water = ResourceRecord.builder()
            .name("Water")
            .category("Liquid")
            .rarity("Common")
            .description("")
            .sourceLocations("Dew collectors, Deathstills")
            .iconPath("icons/water.png")
            .discovered(true)
            .build();
        var stillsuit = RecipeRecord.builder()
            .name("Stillsuit")
            .description("Recycles body moisture")
            .outputItemName("Stillsuit")
            .outputQuantity(1)
            .craftingTimeSeconds(0)
            .requiredStation("Fabricator")
            .skillRequirement("Survival 2")
            .discovered(false)
            .ingredients(List.of(IngredientRef.byName("Water", 4), IngredientRef.byName("Iron Ingot", 2)))
            .build();
        return RecordBatch.of(List.of(water), List.of(stillsuit));
    }

    @Test
    void roundTripsEveryScalarField() {
        var batch = sampleBatch();

        var decoded = codec.decode(codec.encode(batch, EnumSet.allOf(EntityKind.class)));

        assertEquals(batch.resources(), decoded.resources());
        assertEquals(batch.recipes(), decoded.recipes());
        assertEquals(Optional.of(""), decoded.resources().get(0).description());
        assertEquals(Optional.of(0), decoded.recipes().get(0).craftingTimeSeconds());
    }

    @Test
    void writesMetadataAndOnlyRequestedSections() throws Exception {
        var batch = sampleBatch().withMetadata(new ExportMetadata("2024-05-01T10:15:30Z", "0.1.0", 1, 0));

        var tree = new ObjectMapper().readTree(codec.encode(batch, EnumSet.of(EntityKind.RESOURCE)));

        assertEquals("0.1.0", tree.path("metadata").path("app_version").asText());
        assertEquals(1, tree.path("metadata").path("total_resources").asInt());
        assertTrue(tree.has("resources"));
        assertFalse(tree.has("crafting_recipes"));
    }

    @Test
    void readsCompactIngredientForms() {
        var json = """
            {"crafting_recipes": [
              {"name": "Spice Coffee", "output_item_name": "Spice Coffee", "output_quantity": "2",
               "ingredients": ["3x Spice Melange", {"name": "Water", "quantity": 1}, {"resource_id": 7, "quantity": 2}, 42]}
            ]}
            """;

        var recipe = codec.decode(json).recipes().get(0);

        assertEquals(Optional.of(2), recipe.outputQuantity());
        var ingredients = recipe.ingredients().orElseThrow();
        assertEquals(3, ingredients.size());
        assertEquals(IngredientRef.byName("Spice Melange", 3), ingredients.get(0));
        assertEquals(IngredientRef.byName("Water", 1), ingredients.get(1));
        assertEquals(IngredientRef.byId(7, 2), ingredients.get(2));
    }

    @Test
    void distinguishesMissingFromEmptyIngredients() {
        var json = """
            {"crafting_recipes": [
              {"name": "A", "output_item_name": "A"},
              {"name": "B", "output_item_name": "B", "ingredients": []},
              {"name": "C", "output_item_name": "C", "ingredients": "Water"}
            ]}
            """;

        var recipes = codec.decode(json).recipes();

        assertEquals(Optional.empty(), recipes.get(0).ingredients());
        assertEquals(Optional.of(List.of()), recipes.get(1).ingredients());
        assertEquals(Optional.of(List.of()), recipes.get(2).ingredients());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(CodecException.class, () -> codec.decode("{not json"));
        assertThrows(CodecException.class, () -> codec.decode("[]"));
        assertThrows(CodecException.class, () -> codec.decode("{\"resources\": {\"name\": \"Water\"}}"));
    }

    @Test
    void skipsEntriesThatAreNotObjects() {
        var batch = codec.decode("{\"resources\": [\"Water\", {\"name\": \"Sand\"}]}");

        assertEquals(1, batch.resources().size());
        assertEquals("Sand", batch.resources().get(0).name());
    }
}
