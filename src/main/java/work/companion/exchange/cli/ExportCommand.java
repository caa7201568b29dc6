package work.companion.exchange.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import work.companion.exchange.api.EntityScope;
import work.companion.exchange.api.ExchangeReport;
import work.companion.exchange.api.ExchangeService;
import work.companion.exchange.codec.ExchangeFormat;
import work.companion.exchange.config.ExchangeSettings;
import work.companion.exchange.store.SqliteStoreGateway;

@CommandLine.Command(
    name = "export",
    description = "Export resources and crafting recipes to a document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExportCommand implements Callable<Integer> {
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
        names = {"-k", "--kind"},
        description = "Entities to export (all|resources|recipes).",
        defaultValue = "all"
    )
    private String kind;

    @CommandLine.Option(
        names = {"-o", "--out"},
        required = true,
        paramLabel = "PATH",
        description = "Output file; a directory for csv."
    )
    private Path out;

    @Override
    public Integer call() {
        ExchangeFormat exchangeFormat = parse(() -> ExchangeFormat.from(format));
        EntityScope scope = parse(() -> EntityScope.from(kind));
        ExchangeSettings settings = parse(store::settings);
        try (var gateway = SqliteStoreGateway.open(settings.databasePath())) {
            ExchangeReport report = new ExchangeService(gateway, settings)
                .exportTo(out.toAbsolutePath().normalize(), exchangeFormat, scope);
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
