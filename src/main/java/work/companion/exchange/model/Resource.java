package work.companion.exchange.model;

import java.util.Objects;

/**
 * Resource as persisted by the store.
 */
public record Resource(
    long id,
    String name,
    String category,
    String rarity,
    String description,
    String sourceLocations,
    String iconPath,
    boolean discovered,
    String createdAt,
    String updatedAt
) {
    public Resource {
        Objects.requireNonNull(name, "name");
    }

    public ResourceRecord toRecord() {
        return ResourceRecord.builder()
            .id(id)
            .name(name)
            .category(category)
            .rarity(rarity)
            .description(description)
            .sourceLocations(sourceLocations)
            .iconPath(iconPath)
            .discovered(discovered)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
