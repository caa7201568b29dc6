package work.companion.exchange.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.companion.exchange.reconcile.MergeStrategy;

/**
 * Settings shared by the CLI and embedding applications.
 *
 * <pre>
 * [exchange]
 * app_version = "0.1.0"
 * default_strategy = "update"
 * [store]
 * database = "companion.db"
 * </pre>
 */
public record ExchangeSettings(String appVersion, MergeStrategy defaultStrategy, Path databasePath) {
    public static final String DEFAULT_APP_VERSION = "0.1.0";
    public static final Path DEFAULT_DATABASE = Path.of("companion.db");

    public ExchangeSettings {
        Objects.requireNonNull(appVersion, "appVersion");
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        Objects.requireNonNull(databasePath, "databasePath");
    }

    public static ExchangeSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .appVersion(appVersion)
            .defaultStrategy(defaultStrategy)
            .databasePath(databasePath);
    }

    /**
     * Reads settings from a TOML file. A missing file yields the defaults; relative database paths
     * are resolved against the file's directory.
     */
    public static ExchangeSettings load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return defaults();
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read settings " + file, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings file " + file + ": " + errors);
        }
        var builder = builder();
        Optional.ofNullable(result.getString("exchange.app_version")).ifPresent(builder::appVersion);
        Optional.ofNullable(result.getString("exchange.default_strategy"))
            .map(MergeStrategy::from)
            .ifPresent(builder::defaultStrategy);
        Optional.ofNullable(result.getString("store.database")).ifPresent(database -> {
            Path path = Path.of(database);
            Path base = file.toAbsolutePath().getParent();
            builder.databasePath(path.isAbsolute() || base == null ? path : base.resolve(path).normalize());
        });
        return builder.build();
    }

    public static final class Builder {
        private String appVersion = DEFAULT_APP_VERSION;
        private MergeStrategy defaultStrategy = MergeStrategy.UPDATE;
        private Path databasePath = DEFAULT_DATABASE;

        public Builder appVersion(String appVersion) {
            this.appVersion = appVersion;
            return this;
        }

        public Builder defaultStrategy(MergeStrategy defaultStrategy) {
            this.defaultStrategy = defaultStrategy;
            return this;
        }

        public Builder databasePath(Path databasePath) {
            this.databasePath = databasePath;
            return this;
        }

        public ExchangeSettings build() {
            return new ExchangeSettings(appVersion, defaultStrategy, databasePath);
        }
    }
}
