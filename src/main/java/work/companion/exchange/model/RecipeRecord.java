package work.companion.exchange.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical crafting recipe record. Same presence rules as {@link ResourceRecord}; in addition
 * {@code ingredients} is present (possibly empty) only when the source carried an ingredients entry,
 * in which case it replaces the stored ingredient list as a whole.
 */
public record RecipeRecord(
    Optional<Long> id,
    String name,
    Optional<String> description,
    Optional<String> outputItemName,
    Optional<Integer> outputQuantity,
    Optional<Integer> craftingTimeSeconds,
    Optional<String> requiredStation,
    Optional<String> skillRequirement,
    Optional<String> iconPath,
    Optional<Boolean> discovered,
    Optional<List<IngredientRef>> ingredients,
    Optional<String> createdAt,
    Optional<String> updatedAt
) {
    public RecipeRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(outputItemName, "outputItemName");
        Objects.requireNonNull(outputQuantity, "outputQuantity");
        Objects.requireNonNull(craftingTimeSeconds, "craftingTimeSeconds");
        Objects.requireNonNull(requiredStation, "requiredStation");
        Objects.requireNonNull(skillRequirement, "skillRequirement");
        Objects.requireNonNull(iconPath, "iconPath");
        Objects.requireNonNull(discovered, "discovered");
        Objects.requireNonNull(ingredients, "ingredients");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        ingredients = ingredients.map(List::copyOf);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.id = id;
        builder.name = name;
        builder.description = description;
        builder.outputItemName = outputItemName;
        builder.outputQuantity = outputQuantity;
        builder.craftingTimeSeconds = craftingTimeSeconds;
        builder.requiredStation = requiredStation;
        builder.skillRequirement = skillRequirement;
        builder.iconPath = iconPath;
        builder.discovered = discovered;
        builder.ingredients = ingredients.map(ArrayList::new);
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        return builder;
    }

    /** Same record with the store-assigned identity and timestamps dropped. */
    public RecipeRecord contentOnly() {
        return toBuilder().id(null).createdAt(null).updatedAt(null).build();
    }

    public boolean hasScalarChanges() {
        return description.isPresent()
            || outputItemName.isPresent()
            || outputQuantity.isPresent()
            || craftingTimeSeconds.isPresent()
            || requiredStation.isPresent()
            || skillRequirement.isPresent()
            || iconPath.isPresent()
            || discovered.isPresent();
    }

    public static final class Builder {
        private Optional<Long> id = Optional.empty();
        private String name;
        private Optional<String> description = Optional.empty();
        private Optional<String> outputItemName = Optional.empty();
        private Optional<Integer> outputQuantity = Optional.empty();
        private Optional<Integer> craftingTimeSeconds = Optional.empty();
        private Optional<String> requiredStation = Optional.empty();
        private Optional<String> skillRequirement = Optional.empty();
        private Optional<String> iconPath = Optional.empty();
        private Optional<Boolean> discovered = Optional.empty();
        private Optional<List<IngredientRef>> ingredients = Optional.empty();
        private Optional<String> createdAt = Optional.empty();
        private Optional<String> updatedAt = Optional.empty();

        public Builder id(Long id) {
            this.id = Optional.ofNullable(id);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public String name() {
            return name;
        }

        public Builder description(String description) {
            this.description = Optional.ofNullable(description);
            return this;
        }

        public Builder outputItemName(String outputItemName) {
            this.outputItemName = Optional.ofNullable(outputItemName);
            return this;
        }

        public Builder outputQuantity(Integer outputQuantity) {
            this.outputQuantity = Optional.ofNullable(outputQuantity);
            return this;
        }

        public Builder craftingTimeSeconds(Integer craftingTimeSeconds) {
            this.craftingTimeSeconds = Optional.ofNullable(craftingTimeSeconds);
            return this;
        }

        public Builder requiredStation(String requiredStation) {
            this.requiredStation = Optional.ofNullable(requiredStation);
            return this;
        }

        public Builder skillRequirement(String skillRequirement) {
            this.skillRequirement = Optional.ofNullable(skillRequirement);
            return this;
        }

        public Builder iconPath(String iconPath) {
            this.iconPath = Optional.ofNullable(iconPath);
            return this;
        }

        public Builder discovered(Boolean discovered) {
            this.discovered = Optional.ofNullable(discovered);
            return this;
        }

        /** Marks the ingredient list as supplied; {@code null} marks it absent again. */
        public Builder ingredients(List<IngredientRef> ingredients) {
            this.ingredients = Optional.ofNullable(ingredients).map(ArrayList::new);
            return this;
        }

        public Builder addIngredient(IngredientRef ingredient) {
            if (ingredients.isEmpty()) {
                ingredients = Optional.of(new ArrayList<>());
            }
            ingredients.get().add(Objects.requireNonNull(ingredient, "ingredient"));
            return this;
        }

        public Builder createdAt(String createdAt) {
            this.createdAt = Optional.ofNullable(createdAt);
            return this;
        }

        public Builder updatedAt(String updatedAt) {
            this.updatedAt = Optional.ofNullable(updatedAt);
            return this;
        }

        public RecipeRecord build() {
            return new RecipeRecord(
                id,
                name,
                description,
                outputItemName,
                outputQuantity,
                craftingTimeSeconds,
                requiredStation,
                skillRequirement,
                iconPath,
                discovered,
                ingredients,
                createdAt,
                updatedAt
            );
        }
    }
}
