package work.companion.exchange.api;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.codec.CodecException;
import work.companion.exchange.codec.DocumentCodec;
import work.companion.exchange.codec.ExchangeFormat;
import work.companion.exchange.config.ExchangeSettings;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.EntityKind;
import work.companion.exchange.model.ExportMetadata;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.RecordBatch;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;
import work.companion.exchange.reconcile.MergeStrategy;
import work.companion.exchange.reconcile.ReconciliationEngine;
import work.companion.exchange.reconcile.RecordOutcome;
import work.companion.exchange.store.StoreException;
import work.companion.exchange.store.StoreGateway;

/**
 * Library entry points for exporting the store to a document and importing a document back.
 *
 * <p>None of the entry points throw for unreadable or malformed input: the {@code boolean}
 * variants return {@code false} and the report variants return a failed {@link ExchangeReport}.
 */
public final class ExchangeService {
    private static final Logger LOG = LoggerFactory.getLogger(ExchangeService.class);

    private final StoreGateway store;
    private final ReconciliationEngine engine;
    private final ExchangeSettings settings;
    private final Clock clock;

    public ExchangeService(StoreGateway store) {
        this(store, ExchangeSettings.defaults());
    }

    public ExchangeService(StoreGateway store, ExchangeSettings settings) {
        this(store, settings, Clock.systemUTC());
    }

    public ExchangeService(StoreGateway store, ExchangeSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.engine = new ReconciliationEngine(store);
    }

    // --- export ---

    public boolean exportData(Path destination, ExchangeFormat format) {
        return exportTo(destination, format, EntityScope.ALL).succeeded();
    }

    public boolean exportData(Path destination, String format) {
        return exportTo(destination, format, EntityScope.ALL).succeeded();
    }

    public boolean exportResources(Path destination, ExchangeFormat format) {
        return exportTo(destination, format, EntityScope.RESOURCES).succeeded();
    }

    public boolean exportResources(Path destination, String format) {
        return exportTo(destination, format, EntityScope.RESOURCES).succeeded();
    }

    public boolean exportRecipes(Path destination, ExchangeFormat format) {
        return exportTo(destination, format, EntityScope.RECIPES).succeeded();
    }

    public boolean exportRecipes(Path destination, String format) {
        return exportTo(destination, format, EntityScope.RECIPES).succeeded();
    }

    public ExchangeReport exportTo(Path destination, String format, EntityScope scope) {
        Instant startedAt = Instant.now();
        ExchangeFormat parsed;
        try {
            parsed = ExchangeFormat.from(format);
        } catch (IllegalArgumentException ex) {
            LOG.error("Export aborted: {}", ex.getMessage());
            return ExchangeReport.failure("export", ex.getMessage(), Map.of(), startedAt);
        }
        return exportTo(destination, parsed, scope);
    }

    public ExchangeReport exportTo(Path destination, ExchangeFormat format, EntityScope scope) {
        Instant startedAt = Instant.now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", format.id());
        metadata.put("scope", scope.name().toLowerCase(Locale.ROOT));
        metadata.put("destination", String.valueOf(destination));
        try {
            Set<EntityKind> kinds = scope.kinds();
            RecordBatch batch = snapshot(kinds);
            DocumentCodec.forFormat(format).write(batch, kinds, destination);
            metadata.put("resources", batch.resources().size());
            metadata.put("recipes", batch.recipes().size());
            LOG.info("Exported {} resource(s) and {} crafting recipe(s) as {} to {}",
                batch.resources().size(), batch.recipes().size(), format.id(), destination);
            return ExchangeReport.success("export", List.of(), metadata, startedAt);
        } catch (IOException ex) {
            LOG.error("Export to {} failed: {}", destination, ex.getMessage());
            return ExchangeReport.failure("export", "I/O error: " + ex.getMessage(), metadata, startedAt);
        } catch (CodecException | StoreException ex) {
            LOG.error("Export to {} failed: {}", destination, ex.getMessage());
            return ExchangeReport.failure("export", ex.getMessage(), metadata, startedAt);
        }
    }

    private RecordBatch snapshot(Set<EntityKind> kinds) {
        List<ResourceRecord> resources = new ArrayList<>();
        if (kinds.contains(EntityKind.RESOURCE)) {
            for (Resource resource : store.listResources()) {
                resources.add(resource.toRecord());
            }
        }
        List<RecipeRecord> recipes = new ArrayList<>();
        if (kinds.contains(EntityKind.RECIPE)) {
            for (CraftingRecipe recipe : store.listRecipes()) {
                recipes.add(recipe.toRecord());
            }
        }
        var metadata = new ExportMetadata(
            clock.instant().toString(),
            settings.appVersion(),
            resources.size(),
            recipes.size()
        );
        return RecordBatch.of(resources, recipes).withMetadata(metadata);
    }

    // --- import ---

    public boolean importData(Path source, ExchangeFormat format, MergeStrategy strategy) {
        return importFrom(source, format, strategy).succeeded();
    }

    public boolean importData(Path source, ExchangeFormat format) {
        return importFrom(source, format, settings.defaultStrategy()).succeeded();
    }

    public boolean importData(Path source, String format, String strategy) {
        return importFrom(source, format, strategy).succeeded();
    }

    public ExchangeReport importFrom(Path source, String format, String strategy) {
        Instant startedAt = Instant.now();
        ExchangeFormat parsedFormat;
        MergeStrategy parsedStrategy;
        try {
            parsedFormat = ExchangeFormat.from(format);
            parsedStrategy = strategy == null || strategy.isBlank()
                ? settings.defaultStrategy()
                : MergeStrategy.from(strategy);
        } catch (IllegalArgumentException ex) {
            LOG.error("Import aborted: {}", ex.getMessage());
            return ExchangeReport.failure("import", ex.getMessage(), Map.of(), startedAt);
        }
        return importFrom(source, parsedFormat, parsedStrategy);
    }

    public ExchangeReport importFrom(Path source, ExchangeFormat format, MergeStrategy strategy) {
        Instant startedAt = Instant.now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", format.id());
        metadata.put("strategy", strategy.id());
        metadata.put("source", String.valueOf(source));
        RecordBatch batch;
        try {
            batch = DocumentCodec.forFormat(format).read(source);
        } catch (IOException ex) {
            LOG.error("Import from {} failed: {}", source, ex.getMessage());
            return ExchangeReport.failure("import", "I/O error: " + ex.getMessage(), metadata, startedAt);
        } catch (CodecException ex) {
            LOG.error("Import from {} failed: {}", source, ex.getMessage());
            return ExchangeReport.failure("import", ex.getMessage(), metadata, startedAt);
        }
        batch.metadata().ifPresent(meta ->
            LOG.debug("Importing document exported {} by version {}", meta.exportDate(), meta.appVersion()));
        List<RecordOutcome> outcomes = new ArrayList<>();
        outcomes.addAll(engine.reconcileResources(batch.resources(), strategy));
        outcomes.addAll(engine.reconcileRecipes(batch.recipes(), strategy));
        var report = ExchangeReport.success("import", outcomes, metadata, startedAt);
        LOG.info("Imported {} from {} using {}: {}", format.id(), source, strategy.id(), report.counts());
        return report;
    }
}
