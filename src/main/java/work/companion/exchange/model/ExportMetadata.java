package work.companion.exchange.model;

import java.util.Objects;

/**
 * Header written in front of exported documents.
 */
public record ExportMetadata(String exportDate, String appVersion, int totalResources, int totalRecipes) {
    public ExportMetadata {
        Objects.requireNonNull(exportDate, "exportDate");
        Objects.requireNonNull(appVersion, "appVersion");
    }
}
