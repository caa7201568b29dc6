package work.companion.exchange.codec;

/**
 * Raised when a document cannot be decoded at all (unparsable content, wrong top-level shape).
 * Aborts the whole import; problems with single records are logged and skipped instead.
 */
public final class CodecException extends RuntimeException {
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
