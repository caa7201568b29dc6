package work.companion.exchange.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.IngredientRef;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.shared.QuantityPrefix;
import work.companion.exchange.shared.TextValues;

/**
 * Accumulator driven line by line by {@link MarkdownDocumentCodec}.
 *
 * <p>It tracks the current section and the entity being collected. The pending entity is only added
 * to the result on {@link #flush()}, which happens on the next heading and must be called once more
 * at end of input ({@link #finish()} does that).
 */
public final class MarkdownParseState {
    private static final Logger LOG = LoggerFactory.getLogger(MarkdownParseState.class);

    public enum Section {
        NONE,
        RESOURCES,
        RECIPES
    }

    private static final Map<String, BiConsumer<ResourceRecord.Builder, String>> RESOURCE_FIELDS = Map.of(
        "name", ResourceRecord.Builder::name,
        "category", ResourceRecord.Builder::category,
        "rarity", ResourceRecord.Builder::rarity,
        "description", ResourceRecord.Builder::description,
        "source_locations", ResourceRecord.Builder::sourceLocations,
        "icon_path", ResourceRecord.Builder::iconPath,
        "discovered", (item, value) -> item.discovered(flag(value, item.name()))
    );

    private static final Map<String, BiConsumer<RecipeRecord.Builder, String>> RECIPE_FIELDS = Map.ofEntries(
        Map.entry("name", RecipeRecord.Builder::name),
        Map.entry("output", MarkdownParseState::applyOutput),
        Map.entry("output_item_name", RecipeRecord.Builder::outputItemName),
        Map.entry("output_quantity", (item, value) -> item.outputQuantity(TextValues.parseInt(value).orElse(null))),
        Map.entry("station", RecipeRecord.Builder::requiredStation),
        Map.entry("required_station", RecipeRecord.Builder::requiredStation),
        Map.entry("time", MarkdownParseState::applyTime),
        Map.entry("crafting_time_seconds", MarkdownParseState::applyTime),
        Map.entry("skill_required", RecipeRecord.Builder::skillRequirement),
        Map.entry("skill_requirement", RecipeRecord.Builder::skillRequirement),
        Map.entry("description", RecipeRecord.Builder::description),
        Map.entry("icon_path", RecipeRecord.Builder::iconPath),
        Map.entry("discovered", (item, value) -> item.discovered(flag(value, item.name()))),
        Map.entry("ingredient", MarkdownParseState::applyIngredient),
        Map.entry("ingredients", MarkdownParseState::applyIngredient)
    );

    private final List<ResourceRecord> resources = new ArrayList<>();
    private final List<RecipeRecord> recipes = new ArrayList<>();
    private Section currentSection = Section.NONE;
    private ResourceRecord.Builder pendingResource;
    private RecipeRecord.Builder pendingRecipe;

    public Section currentSection() {
        return currentSection;
    }

    public boolean hasPendingItem() {
        return pendingResource != null || pendingRecipe != null;
    }

    public List<ResourceRecord> resources() {
        return List.copyOf(resources);
    }

    public List<RecipeRecord> recipes() {
        return List.copyOf(recipes);
    }

    /** Level-2 heading. */
    public void enterSection(String title) {
        flush();
        currentSection = sectionFor(title);
    }

    /** Level-3 heading. Entities outside a known section are not collected. */
    public void startEntity(String name) {
        flush();
        switch (currentSection) {
            case RESOURCES -> pendingResource = ResourceRecord.builder().name(name);
            case RECIPES -> pendingRecipe = RecipeRecord.builder().name(name).ingredients(List.of());
            case NONE -> LOG.debug("Ignoring entity '{}' outside of a known section", name);
        }
    }

    /**
     * Bullet line content after the leading {@code "- "}. Lines without a colon are logged and
     * skipped; unknown keys are ignored.
     */
    public void applyBullet(String content) {
        if (!hasPendingItem()) {
            return;
        }
        int colon = content.indexOf(':');
        if (colon < 0) {
            LOG.warn("Skipping malformed line without a key: '- {}'", content);
            return;
        }
        String rawKey = content.substring(0, colon).strip();
        String value = content.substring(colon + 1).strip();
        if (startsWithEmphasis(rawKey) && !endsWithEmphasis(rawKey)) {
            // "**Key:** Value" splits inside the emphasis; the closing marker sits in front of the value
            value = stripClosingMarker(value, leadingEmphasis(rawKey));
        }
        String key = normalizeKey(rawKey);
        if (key.isEmpty()) {
            LOG.warn("Skipping line with an empty key: '- {}'", content);
            return;
        }
        if (pendingResource != null) {
            var setter = RESOURCE_FIELDS.get(key);
            if (setter != null) {
                setter.accept(pendingResource, value);
            }
        } else {
            var setter = RECIPE_FIELDS.get(key);
            if (setter != null) {
                setter.accept(pendingRecipe, value);
            }
        }
    }

    /** Moves the pending entity, if any, into the result lists. */
    public void flush() {
        if (pendingResource != null) {
            resources.add(pendingResource.build());
            pendingResource = null;
        }
        if (pendingRecipe != null) {
            recipes.add(pendingRecipe.build());
            pendingRecipe = null;
        }
    }

    public RecordBatch finish() {
        flush();
        currentSection = Section.NONE;
        return RecordBatch.of(resources, recipes);
    }

    static Section sectionFor(String title) {
        String normalized = title == null ? "" : title.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "resources" -> Section.RESOURCES;
            case "crafting recipes", "recipes" -> Section.RECIPES;
            default -> Section.NONE;
        };
    }

    static String normalizeKey(String rawKey) {
        String key = stripEmphasis(rawKey.strip());
        if (key.endsWith(":")) {
            key = key.substring(0, key.length() - 1);
        }
        key = stripEmphasis(key).strip();
        return key.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static String stripEmphasis(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isEmphasis(value.charAt(start))) {
            start++;
        }
        while (end > start && isEmphasis(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).strip();
    }

    /** Removes at most {@code width} emphasis characters from the front of {@code value}. */
    static String stripClosingMarker(String value, int width) {
        int start = 0;
        while (start < width && start < value.length() && isEmphasis(value.charAt(start))) {
            start++;
        }
        return value.substring(start).strip();
    }

    private static int leadingEmphasis(String value) {
        int count = 0;
        while (count < value.length() && isEmphasis(value.charAt(count))) {
            count++;
        }
        return count;
    }

    private static boolean startsWithEmphasis(String value) {
        return !value.isEmpty() && isEmphasis(value.charAt(0));
    }

    private static boolean endsWithEmphasis(String value) {
        return !value.isEmpty() && isEmphasis(value.charAt(value.length() - 1));
    }

    private static boolean isEmphasis(char c) {
        return c == '*' || c == '_';
    }

    private static void applyOutput(RecipeRecord.Builder item, String value) {
        var parsed = QuantityPrefix.parse(value);
        item.outputQuantity(parsed.quantity());
        item.outputItemName(parsed.name().isEmpty() ? value : parsed.name());
    }

    private static void applyTime(RecipeRecord.Builder item, String value) {
        var seconds = TextValues.parseLeadingInt(value);
        if (seconds.isEmpty()) {
            LOG.warn("Ignoring unreadable crafting time '{}' for recipe '{}'", value, item.name());
            return;
        }
        item.craftingTimeSeconds(seconds.get());
    }

    private static void applyIngredient(RecipeRecord.Builder item, String value) {
        var parsed = QuantityPrefix.parse(value);
        if (parsed.name().isEmpty()) {
            LOG.warn("Ignoring ingredient without a name for recipe '{}': '{}'", item.name(), value);
            return;
        }
        item.addIngredient(IngredientRef.byName(parsed.name(), parsed.quantity()));
    }

    private static Boolean flag(String value, String owner) {
        var parsed = TextValues.parseFlag(value);
        if (parsed.isEmpty()) {
            LOG.warn("Ignoring unreadable discovered flag '{}' for '{}'", value, owner);
        }
        return parsed.orElse(null);
    }
}
