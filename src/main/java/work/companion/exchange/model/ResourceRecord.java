package work.companion.exchange.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Canonical resource record decoded from (or encoded to) an external document.
 *
 * <p>Every field except {@code name} is option-wrapped: an empty value means the document did not
 * supply it, which keeps "absent" distinct from a legitimate empty or zero value. {@code name} may be
 * {@code null} when the source omitted it; such records are rejected during reconciliation.
 */
public record ResourceRecord(
    Optional<Long> id,
    String name,
    Optional<String> category,
    Optional<String> rarity,
    Optional<String> description,
    Optional<String> sourceLocations,
    Optional<String> iconPath,
    Optional<Boolean> discovered,
    Optional<String> createdAt,
    Optional<String> updatedAt
) {
    public ResourceRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(rarity, "rarity");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(sourceLocations, "sourceLocations");
        Objects.requireNonNull(iconPath, "iconPath");
        Objects.requireNonNull(discovered, "discovered");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.id = id;
        builder.name = name;
        builder.category = category;
        builder.rarity = rarity;
        builder.description = description;
        builder.sourceLocations = sourceLocations;
        builder.iconPath = iconPath;
        builder.discovered = discovered;
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        return builder;
    }

    /** Same record with the store-assigned identity and timestamps dropped. */
    public ResourceRecord contentOnly() {
        return toBuilder().id(null).createdAt(null).updatedAt(null).build();
    }

    public boolean hasScalarChanges() {
        return category.isPresent()
            || rarity.isPresent()
            || description.isPresent()
            || sourceLocations.isPresent()
            || iconPath.isPresent()
            || discovered.isPresent();
    }

    public static final class Builder {
        private Optional<Long> id = Optional.empty();
        private String name;
        private Optional<String> category = Optional.empty();
        private Optional<String> rarity = Optional.empty();
        private Optional<String> description = Optional.empty();
        private Optional<String> sourceLocations = Optional.empty();
        private Optional<String> iconPath = Optional.empty();
        private Optional<Boolean> discovered = Optional.empty();
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

        public Builder category(String category) {
            this.category = Optional.ofNullable(category);
            return this;
        }

        public Builder rarity(String rarity) {
            this.rarity = Optional.ofNullable(rarity);
            return this;
        }

        public Builder description(String description) {
            this.description = Optional.ofNullable(description);
            return this;
        }

        public Builder sourceLocations(String sourceLocations) {
            this.sourceLocations = Optional.ofNullable(sourceLocations);
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

        public Builder createdAt(String createdAt) {
            this.createdAt = Optional.ofNullable(createdAt);
            return this;
        }

        public Builder updatedAt(String updatedAt) {
            this.updatedAt = Optional.ofNullable(updatedAt);
            return this;
        }

        public ResourceRecord build() {
            return new ResourceRecord(
                id,
                name,
                category,
                rarity,
                description,
                sourceLocations,
                iconPath,
                discovered,
                createdAt,
                updatedAt
            );
        }
    }
}
