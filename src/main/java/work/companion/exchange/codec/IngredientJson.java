package work.companion.exchange.codec;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.shared.QuantityPrefix;
import work.companion.exchange.shared.TextValues;

/**
 * JSON shape of recipe ingredients, shared by the JSON document and the CSV ingredients cell.
 */
final class IngredientJson {
    private static final Logger LOG = LoggerFactory.getLogger(IngredientJson.class);

    private IngredientJson() {}

    static List<Map<String, Object>> toJson(List<IngredientRef> ingredients) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (IngredientRef ingredient : ingredients) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("resource_id", ingredient.resourceId().orElse(null));
            entry.put("resource_name", ingredient.resourceName().orElse(null));
            entry.put("quantity", ingredient.quantity().orElse(null));
            out.add(entry);
        }
        return out;
    }

    /**
     * Reads an ingredient array. A name ({@code resource_name} or {@code name}) wins over
     * {@code resource_id}, since ids are only meaningful in the store that exported them.
     */
    static List<IngredientRef> fromJson(JsonNode array, String recipeName) {
        List<IngredientRef> ingredients = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isTextual()) {
                var parsed = QuantityPrefix.parse(element.asText());
                if (parsed.name().isEmpty()) {
                    LOG.warn("Ignoring empty ingredient entry for recipe '{}'", recipeName);
                    continue;
                }
                ingredients.add(IngredientRef.byName(parsed.name(), parsed.quantity()));
                continue;
            }
            if (!element.isObject()) {
                LOG.warn("Ignoring ingredient entry of recipe '{}' that is not an object: {}", recipeName, element);
                continue;
            }
            String name = TextValues.blankToNull(text(element, "resource_name"));
            if (name == null) {
                name = TextValues.blankToNull(text(element, "name"));
            }
            Optional<Long> id = name == null ? TextValues.parseLong(text(element, "resource_id")) : Optional.empty();
            if (name == null && id.isEmpty()) {
                LOG.warn("Ignoring ingredient entry of recipe '{}' without a resource reference: {}", recipeName, element);
                continue;
            }
            String rawQuantity = text(element, "quantity");
            Optional<Integer> quantity = TextValues.parseInt(rawQuantity);
            if (rawQuantity != null && quantity.isEmpty()) {
                LOG.warn("Unreadable quantity '{}' for ingredient of recipe '{}'", rawQuantity, recipeName);
            }
            ingredients.add(new IngredientRef(id, Optional.ofNullable(name), quantity));
        }
        return ingredients;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
