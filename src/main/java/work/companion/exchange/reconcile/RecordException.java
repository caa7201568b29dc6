package work.companion.exchange.reconcile;

/**
 * Validation or resolution failure scoped to a single imported record.
 */
public final class RecordException extends RuntimeException {
    public RecordException(String message) {
        super(message);
    }
}
