package work.companion.exchange.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.companion.exchange.codec.ExchangeFormat;
import work.companion.exchange.config.ExchangeSettings;

/** Jar version (settings default when run from classes) plus the supported document formats. */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : ExchangeSettings.DEFAULT_APP_VERSION;
        String formats = Arrays.stream(ExchangeFormat.values())
            .map(ExchangeFormat::id)
            .collect(Collectors.joining(", "));
        return new String[] { "companion-exchange " + version, "formats: " + formats };
    }
}
