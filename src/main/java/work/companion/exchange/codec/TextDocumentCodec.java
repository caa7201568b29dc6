package work.companion.exchange.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.RecordBatch;

/**
 * Base for codecs whose document is a single UTF-8 text file.
 */
public abstract class TextDocumentCodec implements DocumentCodec {
    public abstract String encode(RecordBatch batch, Set<EntityKind> kinds);

    public abstract RecordBatch decode(String text);

    @Override
    public void write(RecordBatch batch, Set<EntityKind> kinds, Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(destination, encode(batch, kinds), StandardCharsets.UTF_8);
    }

    @Override
    public RecordBatch read(Path source) throws IOException {
        return decode(Files.readString(source, StandardCharsets.UTF_8));
    }
}
