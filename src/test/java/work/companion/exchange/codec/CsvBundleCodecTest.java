package work.companion.exchange.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;

class CsvBundleCodecTest {
    private final CsvBundleCodec codec = new CsvBundleCodec();

    @Test
    void writesFixedHeaders() {
        String resources = codec.encodeResources(List.of());
        String recipes = codec.encodeRecipes(List.of());

        assertEquals(String.join(",", CsvBundleCodec.RESOURCE_COLUMNS), resources.strip());
        assertEquals(String.join(",", CsvBundleCodec.RECIPE_COLUMNS), recipes.strip());
    }

    @Test
    void keepsQuotedCellsAndIngredientJson() {
        var resource = ResourceRecord.builder()
            .id(3L)
            .name("Water")
            .description("Clear, cold\nand precious")
            .discovered(true)
            .build();
        var recipe = RecipeRecord.builder()
            .name("Stillsuit")
            .outputItemName("Stillsuit")
            .outputQuantity(1)
            .ingredients(List.of(IngredientRef.byName("Water", 4)))
            .build();

        var resources = codec.decodeResources(codec.encodeResources(List.of(resource)));
        var recipes = codec.decodeRecipes(codec.encodeRecipes(List.of(recipe)));

        assertEquals(List.of(resource), resources);
        assertEquals(List.of(recipe), recipes);
    }

    @Test
    void malformedIngredientCellYieldsEmptyList() {
        var csv = "name,output_item_name,ingredients\n"
            + "Stillsuit,Stillsuit,\"[{\"\"resource_name\"\": \"\"Water\"\"\"\n"
            + "Knife,Knife,\n";

        var recipes = codec.decodeRecipes(csv);

        assertEquals(Optional.of(List.of()), recipes.get(0).ingredients());
        assertEquals(Optional.empty(), recipes.get(1).ingredients());
    }

    @Test
    void emptyCellsDecodeAsAbsent() {
        var csv = "id,name,category,rarity,discovered\n,Sand,,Common,\n";

        var sand = codec.decodeResources(csv).get(0);

        assertEquals(Optional.empty(), sand.id());
        assertEquals(Optional.empty(), sand.category());
        assertEquals(Optional.of("Common"), sand.rarity());
        assertEquals(Optional.empty(), sand.discovered());
    }

    @Test
    void unterminatedQuoteIsACodecError() {
        var ex = assertThrows(CodecException.class, () -> codec.decodeResources("name,category\n\"Water,Liquid\n"));

        assertTrue(ex.getMessage().contains(CsvBundleCodec.RESOURCES_FILE));
    }

    @Test
    void requiresNameColumn() {
        assertThrows(CodecException.class, () -> codec.decodeResources("id,category\n1,Liquid\n"));
    }

    @Test
    void writesOnlyRequestedKindFiles(@TempDir Path tempDir) throws Exception {
        var batch = RecordBatch.of(List.of(ResourceRecord.builder().name("Water").build()), List.of());
        Path bundle = tempDir.resolve("bundle");

        codec.write(batch, EnumSet.of(EntityKind.RESOURCE), bundle);

        assertTrue(Files.isRegularFile(bundle.resolve(CsvBundleCodec.RESOURCES_FILE)));
        assertFalse(Files.exists(bundle.resolve(CsvBundleCodec.RECIPES_FILE)));
        var read = codec.read(bundle);
        assertEquals(List.of("Water"), read.resources().stream().map(ResourceRecord::name).toList());
        assertTrue(read.recipes().isEmpty());
    }

    @Test
    void rejectsInvalidBundleShapes(@TempDir Path tempDir) throws Exception {
        Path file = Files.writeString(tempDir.resolve("resources.csv"), "name\nWater\n");
        Path empty = Files.createDirectory(tempDir.resolve("empty"));

        assertThrows(CodecException.class, () -> codec.read(file));
        assertThrows(CodecException.class, () -> codec.read(empty));
    }
}
