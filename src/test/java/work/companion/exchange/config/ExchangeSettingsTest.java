package work.companion.exchange.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.companion.exchange.reconcile.MergeStrategy;

class ExchangeSettingsTest {
    @Test
    void missingFileYieldsDefaults(@TempDir Path tempDir) {
        var settings = ExchangeSettings.load(tempDir.resolve("absent.toml"));

        assertEquals(ExchangeSettings.defaults(), settings);
        assertEquals("0.1.0", settings.appVersion());
        assertEquals(MergeStrategy.UPDATE, settings.defaultStrategy());
    }

    @Test
    void readsTomlTables(@TempDir Path tempDir) throws Exception {
        Path file = Files.writeString(tempDir.resolve("settings.toml"), """
            [exchange]
            app_version = "1.2.3"
            default_strategy = "replace"

            [store]
            database = "data/companion.db"
            """);

        var settings = ExchangeSettings.load(file);

        assertEquals("1.2.3", settings.appVersion());
        assertEquals(MergeStrategy.REPLACE, settings.defaultStrategy());
        assertEquals(tempDir.toAbsolutePath().resolve("data/companion.db").normalize(), settings.databasePath());
    }

    @Test
    void partialFileKeepsRemainingDefaults(@TempDir Path tempDir) throws Exception {
        Path file = Files.writeString(tempDir.resolve("settings.toml"), "[exchange]\ndefault_strategy = \"skip\"\n");

        var settings = ExchangeSettings.load(file);

        assertEquals(MergeStrategy.SKIP, settings.defaultStrategy());
        assertEquals(ExchangeSettings.DEFAULT_APP_VERSION, settings.appVersion());
        assertEquals(ExchangeSettings.DEFAULT_DATABASE, settings.databasePath());
    }

    @Test
    void rejectsInvalidFiles(@TempDir Path tempDir) throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.toml"), "[exchange\napp_version = ");
        Path badStrategy = Files.writeString(tempDir.resolve("strategy.toml"), "[exchange]\ndefault_strategy = \"merge\"\n");

        assertThrows(IllegalArgumentException.class, () -> ExchangeSettings.load(broken));
        assertThrows(IllegalArgumentException.class, () -> ExchangeSettings.load(badStrategy));
    }
}
