package work.companion.exchange.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.shared.TextValues;

/**
 * CSV bundle: a directory with {@code resources.csv} and {@code crafting_recipes.csv}. Recipe
 * ingredients are stored as a JSON array inside the {@code ingredients} cell.
 */
public final class CsvBundleCodec implements DocumentCodec {
    private static final Logger LOG = LoggerFactory.getLogger(CsvBundleCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String RESOURCES_FILE = "resources.csv";
    public static final String RECIPES_FILE = "crafting_recipes.csv";

    static final List<String> RESOURCE_COLUMNS = List.of(
        "id", "name", "category", "rarity", "description", "source_locations",
        "icon_path", "discovered", "created_at", "updated_at"
    );
    static final List<String> RECIPE_COLUMNS = List.of(
        "id", "name", "description", "output_item_name", "output_quantity", "crafting_time_seconds",
        "required_station", "skill_requirement", "icon_path", "discovered", "ingredients", "created_at", "updated_at"
    );

    @Override
    public ExchangeFormat format() {
        return ExchangeFormat.CSV;
    }

    @Override
    public void write(RecordBatch batch, Set<EntityKind> kinds, Path destination) throws IOException {
        Files.createDirectories(destination);
        if (kinds.contains(EntityKind.RESOURCE)) {
            Files.writeString(destination.resolve(RESOURCES_FILE), encodeResources(batch.resources()), StandardCharsets.UTF_8);
        }
        if (kinds.contains(EntityKind.RECIPE)) {
            Files.writeString(destination.resolve(RECIPES_FILE), encodeRecipes(batch.recipes()), StandardCharsets.UTF_8);
        }
    }

    @Override
    public RecordBatch read(Path source) throws IOException {
        if (!Files.isDirectory(source)) {
            throw new CodecException("CSV import path must be a directory: " + source);
        }
        Path resourcesFile = source.resolve(RESOURCES_FILE);
        Path recipesFile = source.resolve(RECIPES_FILE);
        boolean hasResources = Files.isRegularFile(resourcesFile);
        boolean hasRecipes = Files.isRegularFile(recipesFile);
        if (!hasResources && !hasRecipes) {
            throw new CodecException("CSV bundle " + source + " contains neither " + RESOURCES_FILE + " nor " + RECIPES_FILE);
        }
        List<ResourceRecord> resources = List.of();
        List<RecipeRecord> recipes = List.of();
        if (hasResources) {
            resources = decodeResources(Files.readString(resourcesFile, StandardCharsets.UTF_8));
        } else {
            LOG.warn("Resources CSV file not found: {}", resourcesFile);
        }
        if (hasRecipes) {
            recipes = decodeRecipes(Files.readString(recipesFile, StandardCharsets.UTF_8));
        } else {
            LOG.warn("Crafting recipes CSV file not found: {}", recipesFile);
        }
        return RecordBatch.of(resources, recipes);
    }

    public String encodeResources(List<ResourceRecord> resources) {
        var out = new StringWriter();
        try (var printer = new CSVPrinter(out, headerFormat(RESOURCE_COLUMNS))) {
            for (ResourceRecord resource : resources) {
                printer.printRecord(
                    resource.id().orElse(null),
                    resource.name(),
                    resource.category().orElse(null),
                    resource.rarity().orElse(null),
                    resource.description().orElse(null),
                    resource.sourceLocations().orElse(null),
                    resource.iconPath().orElse(null),
                    resource.discovered().map(flag -> flag ? 1 : 0).orElse(null),
                    resource.createdAt().orElse(null),
                    resource.updatedAt().orElse(null)
                );
            }
        } catch (IOException ex) {
            throw new CodecException("Unable to write resources CSV: " + ex.getMessage(), ex);
        }
        return out.toString();
    }

    public String encodeRecipes(List<RecipeRecord> recipes) {
        var out = new StringWriter();
        try (var printer = new CSVPrinter(out, headerFormat(RECIPE_COLUMNS))) {
            for (RecipeRecord recipe : recipes) {
                printer.printRecord(
                    recipe.id().orElse(null),
                    recipe.name(),
                    recipe.description().orElse(null),
                    recipe.outputItemName().orElse(null),
                    recipe.outputQuantity().orElse(null),
                    recipe.craftingTimeSeconds().orElse(null),
                    recipe.requiredStation().orElse(null),
                    recipe.skillRequirement().orElse(null),
                    recipe.iconPath().orElse(null),
                    recipe.discovered().map(flag -> flag ? 1 : 0).orElse(null),
                    recipe.ingredients().map(CsvBundleCodec::ingredientsCell).orElse(null),
                    recipe.createdAt().orElse(null),
                    recipe.updatedAt().orElse(null)
                );
            }
        } catch (IOException ex) {
            throw new CodecException("Unable to write crafting recipes CSV: " + ex.getMessage(), ex);
        }
        return out.toString();
    }

    public List<ResourceRecord> decodeResources(String text) {
        List<ResourceRecord> resources = new ArrayList<>();
        for (Row row : parse(text, RESOURCES_FILE)) {
            String name = row.get("name");
            resources.add(ResourceRecord.builder()
                .id(TextValues.parseLong(row.get("id")).orElse(null))
                .name(name)
                .category(row.get("category"))
                .rarity(row.get("rarity"))
                .description(row.get("description"))
                .sourceLocations(row.get("source_locations"))
                .iconPath(row.get("icon_path"))
                .discovered(row.flag("discovered", name))
                .createdAt(row.get("created_at"))
                .updatedAt(row.get("updated_at"))
                .build());
        }
        return resources;
    }

    public List<RecipeRecord> decodeRecipes(String text) {
        List<RecipeRecord> recipes = new ArrayList<>();
        for (Row row : parse(text, RECIPES_FILE)) {
            String name = row.get("name");
            var builder = RecipeRecord.builder()
                .id(TextValues.parseLong(row.get("id")).orElse(null))
                .name(name)
                .description(row.get("description"))
                .outputItemName(row.get("output_item_name"))
                .outputQuantity(row.integer("output_quantity", name))
                .craftingTimeSeconds(row.integer("crafting_time_seconds", name))
                .requiredStation(row.get("required_station"))
                .skillRequirement(row.get("skill_requirement"))
                .iconPath(row.get("icon_path"))
                .discovered(row.flag("discovered", name))
                .createdAt(row.get("created_at"))
                .updatedAt(row.get("updated_at"));
            String cell = row.get("ingredients");
            if (cell != null) {
                builder.ingredients(parseIngredientsCell(cell, name));
            }
            recipes.add(builder.build());
        }
        return recipes;
    }

    private static String ingredientsCell(List<IngredientRef> ingredients) {
        try {
            return JSON.writeValueAsString(IngredientJson.toJson(ingredients));
        } catch (JsonProcessingException ex) {
            throw new CodecException("Unable to serialize ingredients: " + ex.getOriginalMessage(), ex);
        }
    }

    private static List<IngredientRef> parseIngredientsCell(String cell, String recipeName) {
        try {
            JsonNode node = JSON.readTree(cell);
            if (node != null && node.isArray()) {
                return IngredientJson.fromJson(node, recipeName);
            }
            LOG.warn("Ingredients cell of recipe '{}' is not a JSON array: {}", recipeName, cell);
        } catch (JsonProcessingException ex) {
            LOG.warn("Could not parse ingredients JSON for recipe '{}': {}", recipeName, ex.getOriginalMessage());
        }
        return List.of();
    }

    private static CSVFormat headerFormat(List<String> columns) {
        return CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(String[]::new))
            .setRecordSeparator("\n")
            .build();
    }

    private static List<Row> parse(String text, String fileName) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();
        try (CSVParser parser = new CSVParser(new StringReader(stripBom(text)), format)) {
            List<String> headers = parser.getHeaderNames();
            if (headers == null || !headers.contains("name")) {
                throw new CodecException(fileName + " must have a 'name' column");
            }
            List<Row> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(new Row(record));
            }
            return rows;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            throw new CodecException("csv parse error in " + fileName + ": " + ex.getMessage(), ex);
        }
    }

    private static String stripBom(String text) {
        return text.startsWith("﻿") ? text.substring(1) : text;
    }

    private record Row(CSVRecord record) {
        String get(String column) {
            if (!record.isMapped(column) || !record.isSet(column)) {
                return null;
            }
            return TextValues.blankToNull(record.get(column));
        }

        Integer integer(String column, String owner) {
            String raw = get(column);
            Optional<Integer> value = TextValues.parseInt(raw);
            if (raw != null && value.isEmpty()) {
                LOG.warn("Ignoring unreadable {} '{}' of '{}'", column, raw, owner);
            }
            return value.orElse(null);
        }

        Boolean flag(String column, String owner) {
            String raw = get(column);
            Optional<Boolean> value = TextValues.parseFlag(raw);
            if (raw != null && value.isEmpty()) {
                LOG.warn("Ignoring unreadable {} '{}' of '{}'", column, raw, owner);
            }
            return value.orElse(null);
        }
    }
}
