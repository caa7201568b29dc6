package work.companion.exchange.store;

/**
 * Failure reported by a {@link StoreGateway}. The {@link Kind} lets callers tell constraint
 * violations apart from generic storage errors.
 */
public final class StoreException extends RuntimeException {
    public enum Kind {
        DUPLICATE_NAME,
        MISSING_REFERENCE,
        NOT_FOUND,
        FAILURE
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
