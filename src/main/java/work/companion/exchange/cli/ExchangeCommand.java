package work.companion.exchange.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "companion-exchange",
    description = "Export the companion database to JSON, Markdown or CSV and import it back.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {ExportCommand.class, ImportCommand.class}
)
final class ExchangeCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: export or import");
    }
}
