package work.companion.exchange.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import work.companion.exchange.api.ExchangeReport;
import work.companion.exchange.api.ExchangeService;
import work.companion.exchange.codec.ExchangeFormat;
import work.companion.exchange.config.ExchangeSettings;
import work.companion.exchange.reconcile.MergeStrategy;
import work.companion.exchange.store.SqliteStoreGateway;

@CommandLine.Command(
    name = "import",
    description = "Import resources and crafting recipes from a document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ImportCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private StoreOptions store = new StoreOptions();

    @CommandLine.Option(
        names = {"-f", "--format"},
        required = true,
        description = "Document format (json|markdown|csv)."
    )
    private String format;

    @CommandLine.Option(
        names = {"-s", "--strategy"},
        description = "Merge strategy for existing names (update|replace|skip; default: settings).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String strategy;

    @CommandLine.Option(
        names = {"-i", "--in"},
        required = true,
        paramLabel = "PATH",
        description = "Input file; a directory for csv."
    )
    private Path in;

    @Override
    public Integer call() {
        ExchangeFormat exchangeFormat = parse(() -> ExchangeFormat.from(format));
        ExchangeSettings settings = parse(store::settings);
        MergeStrategy mergeStrategy = strategy == null
            ? settings.defaultStrategy()
            : parse(() -> MergeStrategy.from(strategy));
        try (var gateway = SqliteStoreGateway.open(settings.databasePath())) {
            ExchangeReport report = new ExchangeService(gateway, settings)
                .importFrom(in.toAbsolutePath().normalize(), exchangeFormat, mergeStrategy);
            spec.commandLine().getOut().println(report.toPrettyJson());
            return report.status().exitCode();
        }
    }

    private <T> T parse(Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }
}
