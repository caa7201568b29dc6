package work.companion.exchange.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.ExportMetadata;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.shared.TextValues;

/**
 * JSON document: {@code {metadata:{...}, resources:[...], crafting_recipes:[...]}}.
 */
public final class JsonDocumentCodec extends TextDocumentCodec {
    private static final Logger LOG = LoggerFactory.getLogger(JsonDocumentCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    static final String METADATA = "metadata";
    static final String RESOURCES = "resources";
    static final String RECIPES = "crafting_recipes";

    @Override
    public ExchangeFormat format() {
        return ExchangeFormat.JSON;
    }

    @Override
    public String encode(RecordBatch batch, Set<EntityKind> kinds) {
        Map<String, Object> document = new LinkedHashMap<>();
        batch.metadata().ifPresent(meta -> document.put(METADATA, metadataToJson(meta)));
        if (kinds.contains(EntityKind.RESOURCE)) {
            List<Map<String, Object>> resources = new ArrayList<>();
            batch.resources().forEach(resource -> resources.add(resourceToJson(resource)));
            document.put(RESOURCES, resources);
        }
        if (kinds.contains(EntityKind.RECIPE)) {
            List<Map<String, Object>> recipes = new ArrayList<>();
            batch.recipes().forEach(recipe -> recipes.add(recipeToJson(recipe)));
            document.put(RECIPES, recipes);
        }
        try {
            return JSON_WRITER.writeValueAsString(document) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            throw new CodecException("Unable to serialize JSON export: " + ex.getOriginalMessage(), ex);
        }
    }

    @Override
    public RecordBatch decode(String text) {
        JsonNode root;
        try {
            root = JSON.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new CodecException("json parse error: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("JSON document must be an object");
        }
        Optional<ExportMetadata> metadata = Optional.ofNullable(root.get(METADATA))
            .filter(JsonNode::isObject)
            .map(JsonDocumentCodec::metadataFromJson);
        List<ResourceRecord> resources = new ArrayList<>();
        for (JsonNode node : section(root, RESOURCES)) {
            if (!node.isObject()) {
                LOG.warn("Ignoring resources entry that is not an object: {}", node);
                continue;
            }
            resources.add(resourceFromJson(node));
        }
        List<RecipeRecord> recipes = new ArrayList<>();
        for (JsonNode node : section(root, RECIPES)) {
            if (!node.isObject()) {
                LOG.warn("Ignoring crafting_recipes entry that is not an object: {}", node);
                continue;
            }
            recipes.add(recipeFromJson(node));
        }
        return new RecordBatch(metadata, resources, recipes);
    }

    private static Iterable<JsonNode> section(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new CodecException("'" + key + "' must be an array");
        }
        return node;
    }

    private static Map<String, Object> metadataToJson(ExportMetadata metadata) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("export_date", metadata.exportDate());
        json.put("app_version", metadata.appVersion());
        json.put("total_resources", metadata.totalResources());
        json.put("total_recipes", metadata.totalRecipes());
        return json;
    }

    private static ExportMetadata metadataFromJson(JsonNode node) {
        return new ExportMetadata(
            Optional.ofNullable(IngredientJson.text(node, "export_date")).orElse(""),
            Optional.ofNullable(IngredientJson.text(node, "app_version")).orElse(""),
            TextValues.parseInt(IngredientJson.text(node, "total_resources")).orElse(0),
            TextValues.parseInt(IngredientJson.text(node, "total_recipes")).orElse(0)
        );
    }

    static Map<String, Object> resourceToJson(ResourceRecord resource) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", resource.id().orElse(null));
        json.put("name", resource.name());
        json.put("category", resource.category().orElse(null));
        json.put("rarity", resource.rarity().orElse(null));
        json.put("description", resource.description().orElse(null));
        json.put("source_locations", resource.sourceLocations().orElse(null));
        json.put("icon_path", resource.iconPath().orElse(null));
        json.put("discovered", resource.discovered().orElse(null));
        json.put("created_at", resource.createdAt().orElse(null));
        json.put("updated_at", resource.updatedAt().orElse(null));
        return json;
    }

    static Map<String, Object> recipeToJson(RecipeRecord recipe) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", recipe.id().orElse(null));
        json.put("name", recipe.name());
        json.put("description", recipe.description().orElse(null));
        json.put("output_item_name", recipe.outputItemName().orElse(null));
        json.put("output_quantity", recipe.outputQuantity().orElse(null));
        json.put("crafting_time_seconds", recipe.craftingTimeSeconds().orElse(null));
        json.put("required_station", recipe.requiredStation().orElse(null));
        json.put("skill_requirement", recipe.skillRequirement().orElse(null));
        json.put("icon_path", recipe.iconPath().orElse(null));
        json.put("discovered", recipe.discovered().orElse(null));
        json.put("ingredients", recipe.ingredients().map(IngredientJson::toJson).orElse(null));
        json.put("created_at", recipe.createdAt().orElse(null));
        json.put("updated_at", recipe.updatedAt().orElse(null));
        return json;
    }

    private static ResourceRecord resourceFromJson(JsonNode node) {
        String name = IngredientJson.text(node, "name");
        return ResourceRecord.builder()
            .id(TextValues.parseLong(IngredientJson.text(node, "id")).orElse(null))
            .name(name)
            .category(IngredientJson.text(node, "category"))
            .rarity(IngredientJson.text(node, "rarity"))
            .description(IngredientJson.text(node, "description"))
            .sourceLocations(IngredientJson.text(node, "source_locations"))
            .iconPath(IngredientJson.text(node, "icon_path"))
            .discovered(flag(node, "discovered", name))
            .createdAt(IngredientJson.text(node, "created_at"))
            .updatedAt(IngredientJson.text(node, "updated_at"))
            .build();
    }

    private static RecipeRecord recipeFromJson(JsonNode node) {
        String name = IngredientJson.text(node, "name");
        var builder = RecipeRecord.builder()
            .id(TextValues.parseLong(IngredientJson.text(node, "id")).orElse(null))
            .name(name)
            .description(IngredientJson.text(node, "description"))
            .outputItemName(IngredientJson.text(node, "output_item_name"))
            .outputQuantity(integer(node, "output_quantity", name))
            .craftingTimeSeconds(integer(node, "crafting_time_seconds", name))
            .requiredStation(IngredientJson.text(node, "required_station"))
            .skillRequirement(IngredientJson.text(node, "skill_requirement"))
            .iconPath(IngredientJson.text(node, "icon_path"))
            .discovered(flag(node, "discovered", name))
            .createdAt(IngredientJson.text(node, "created_at"))
            .updatedAt(IngredientJson.text(node, "updated_at"));
        JsonNode ingredients = node.get("ingredients");
        if (ingredients != null && !ingredients.isNull()) {
            if (ingredients.isArray()) {
                builder.ingredients(IngredientJson.fromJson(ingredients, name));
            } else {
                LOG.warn("Ingredients of recipe '{}' are not an array; importing it without ingredients", name);
                builder.ingredients(List.of());
            }
        }
        return builder.build();
    }

    private static Integer integer(JsonNode node, String field, String owner) {
        String raw = IngredientJson.text(node, field);
        Optional<Integer> value = TextValues.parseInt(raw);
        if (raw != null && value.isEmpty()) {
            LOG.warn("Ignoring unreadable {} '{}' of '{}'", field, raw, owner);
        }
        return value.orElse(null);
    }

    private static Boolean flag(JsonNode node, String field, String owner) {
        String raw = IngredientJson.text(node, field);
        Optional<Boolean> value = TextValues.parseFlag(raw);
        if (raw != null && value.isEmpty()) {
            LOG.warn("Ignoring unreadable {} '{}' of '{}'", field, raw, owner);
        }
        return value.orElse(null);
    }
}
