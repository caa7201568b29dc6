package work.companion.exchange.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded (or to-be-encoded) content of one exchange document.
 */
public record RecordBatch(Optional<ExportMetadata> metadata, List<ResourceRecord> resources, List<RecipeRecord> recipes) {
    public RecordBatch {
        Objects.requireNonNull(metadata, "metadata");
        resources = resources == null ? List.of() : List.copyOf(resources);
        recipes = recipes == null ? List.of() : List.copyOf(recipes);
    }

    public static RecordBatch of(List<ResourceRecord> resources, List<RecipeRecord> recipes) {
        return new RecordBatch(Optional.empty(), resources, recipes);
    }

    public RecordBatch withMetadata(ExportMetadata metadata) {
        return new RecordBatch(Optional.ofNullable(metadata), resources, recipes);
    }

    public boolean isEmpty() {
        return resources.isEmpty() && recipes.isEmpty();
    }
}
