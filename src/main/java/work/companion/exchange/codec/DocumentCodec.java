package work.companion.exchange.codec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.RecordBatch;

/**
 * Encodes canonical record batches to one exchange format and decodes them back.
 */
public interface DocumentCodec {
    ExchangeFormat format();

    /** Writes the requested entity kinds of {@code batch} to {@code destination}. */
    void write(RecordBatch batch, Set<EntityKind> kinds, Path destination) throws IOException;

    /**
     * Reads {@code source}.
     *
     * @throws CodecException when the content is malformed at the top level
     */
    RecordBatch read(Path source) throws IOException;

    static DocumentCodec forFormat(ExchangeFormat format) {
        return switch (format) {
            case JSON -> new JsonDocumentCodec();
            case MARKDOWN -> new MarkdownDocumentCodec();
            case CSV -> new CsvBundleCodec();
        };
    }
}
