package work.companion.exchange.model;

/**
 * Entity kinds handled by the exchange pipelines.
 */
public enum EntityKind {
    RESOURCE("resource"),
    RECIPE("crafting recipe");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
