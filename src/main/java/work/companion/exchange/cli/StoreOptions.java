package work.companion.exchange.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.companion.exchange.config.ExchangeSettings;

/**
 * Options shared by every subcommand: where the settings file and the database live.
 */
final class StoreOptions {
    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "TOML settings file (default: built-in settings).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--db",
        paramLabel = "FILE",
        description = "SQLite database file (overrides [store].database).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path database;

    ExchangeSettings settings() {
        ExchangeSettings settings = ExchangeSettings.load(config);
        if (database != null) {
            settings = settings.toBuilder().databasePath(database.toAbsolutePath().normalize()).build();
        }
        return settings;
    }
}
