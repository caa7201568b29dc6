package work.companion.exchange.codec;

import java.util.List;
import java.util.Set;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.shared.TextValues;

/**
 * Human-editable Markdown document. The grammar written here is also the accepted import grammar:
 * {@code ## Resources} / {@code ## Crafting Recipes} sections, one {@code ### Name} heading per entity,
 * {@code - **Key:** Value} bullets, and {@code - Ingredient: 3x Iron Ingot} lines.
 */
public final class MarkdownDocumentCodec extends TextDocumentCodec {
    static final String TITLE = "# Dune Companion Data Export";
    static final String RESOURCES_HEADING = "## Resources";
    static final String RECIPES_HEADING = "## Crafting Recipes";

    @Override
    public ExchangeFormat format() {
        return ExchangeFormat.MARKDOWN;
    }

    @Override
    public String encode(RecordBatch batch, Set<EntityKind> kinds) {
        var out = new StringBuilder();
        out.append(TITLE).append("\n\n");
        batch.metadata().ifPresent(meta -> {
            out.append("## Export Information\n\n");
            bullet(out, "Export Date", meta.exportDate());
            bullet(out, "App Version", meta.appVersion());
            bullet(out, "Total Resources", String.valueOf(meta.totalResources()));
            bullet(out, "Total Recipes", String.valueOf(meta.totalRecipes()));
            out.append('\n');
        });
        if (kinds.contains(EntityKind.RESOURCE)) {
            out.append(RESOURCES_HEADING).append("\n\n");
            for (ResourceRecord resource : batch.resources()) {
                writeResource(out, resource);
            }
        }
        if (kinds.contains(EntityKind.RECIPE)) {
            out.append(RECIPES_HEADING).append("\n\n");
            for (RecipeRecord recipe : batch.recipes()) {
                writeRecipe(out, recipe);
            }
        }
        return out.toString();
    }

    private static void writeResource(StringBuilder out, ResourceRecord resource) {
        out.append("### ").append(TextValues.singleLine(resource.name())).append('\n');
        resource.category().ifPresent(v -> bullet(out, "Category", v));
        resource.rarity().ifPresent(v -> bullet(out, "Rarity", v));
        resource.description().ifPresent(v -> bullet(out, "Description", v));
        resource.sourceLocations().ifPresent(v -> bullet(out, "Source Locations", v));
        resource.iconPath().ifPresent(v -> bullet(out, "Icon Path", v));
        resource.discovered().ifPresent(v -> bullet(out, "Discovered", v ? "Yes" : "No"));
        out.append('\n');
    }

    private static void writeRecipe(StringBuilder out, RecipeRecord recipe) {
        out.append("### ").append(TextValues.singleLine(recipe.name())).append('\n');
        recipe.outputItemName().ifPresent(item ->
            bullet(out, "Output", recipe.outputQuantity().orElse(1) + "x " + item));
        recipe.requiredStation().ifPresent(v -> bullet(out, "Station", v));
        recipe.craftingTimeSeconds().ifPresent(v -> bullet(out, "Time", v + " seconds"));
        recipe.skillRequirement().ifPresent(v -> bullet(out, "Skill Required", v));
        recipe.description().ifPresent(v -> bullet(out, "Description", v));
        recipe.iconPath().ifPresent(v -> bullet(out, "Icon Path", v));
        recipe.discovered().ifPresent(v -> bullet(out, "Discovered", v ? "Yes" : "No"));
        for (IngredientRef ingredient : recipe.ingredients().orElse(List.of())) {
            String name = ingredient.resourceName()
                .orElseGet(() -> ingredient.resourceId().map(id -> "#" + id).orElse("?"));
            out.append("- Ingredient: ")
                .append(ingredient.quantity().orElse(1))
                .append("x ")
                .append(TextValues.singleLine(name))
                .append('\n');
        }
        out.append('\n');
    }

    private static void bullet(StringBuilder out, String key, String value) {
        out.append("- **").append(key).append(":** ").append(TextValues.singleLine(value)).append('\n');
    }

    @Override
    public RecordBatch decode(String text) {
        var state = new MarkdownParseState();
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("### ")) {
                state.startEntity(line.substring(4).strip());
            } else if (line.startsWith("## ")) {
                state.enterSection(line.substring(3));
            } else if (line.startsWith("- ")) {
                state.applyBullet(line.substring(2));
            }
        }
        RecordBatch batch = state.finish();
        if (batch.isEmpty()) {
            throw new CodecException("No resources or crafting recipes found in Markdown document");
        }
        return batch;
    }
}
