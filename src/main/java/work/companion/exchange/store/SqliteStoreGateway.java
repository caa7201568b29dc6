package work.companion.exchange.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.companion.exchange.model.CraftingRecipe;
import work.companion.exchange.model.Ingredient;
import work.companion.exchange.model.IngredientLink;
import work.companion.exchange.model.RecipeRecord;
import work.companion.exchange.model.Resource;
import work.companion.exchange.model.ResourceRecord;

/**
 * {@link StoreGateway} backed by a single SQLite connection.
 */
public final class SqliteStoreGateway implements StoreGateway {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteStoreGateway.class);

    private static final String RESOURCE_COLUMNS =
        "id, name, category, rarity, description, source_locations, icon_path, discovered, created_at, updated_at";
    private static final String RECIPE_COLUMNS =
        "id, name, description, output_item_name, output_quantity, crafting_time_seconds, required_station, "
            + "skill_requirement, icon_path, discovered, created_at, updated_at";

    private final Connection connection;
    private final Clock clock;

    private SqliteStoreGateway(Connection connection, Clock clock) {
        this.connection = connection;
        this.clock = clock;
    }

    public static SqliteStoreGateway open(Path databaseFile) {
        return open(databaseFile, Clock.systemUTC());
    }

    public static SqliteStoreGateway open(Path databaseFile, Clock clock) {
        Objects.requireNonNull(databaseFile, "databaseFile");
        Path absolute = databaseFile.toAbsolutePath().normalize();
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new StoreException(StoreException.Kind.FAILURE, "Unable to create database directory for " + absolute, ex);
        }
        return connect("jdbc:sqlite:" + absolute, clock);
    }

    public static SqliteStoreGateway openInMemory() {
        return connect("jdbc:sqlite::memory:", Clock.systemUTC());
    }

    private static SqliteStoreGateway connect(String url, Clock clock) {
        try {
            var gateway = new SqliteStoreGateway(DriverManager.getConnection(url), clock);
            gateway.init();
            LOG.debug("Opened store at {}", url);
            return gateway;
        } catch (SQLException ex) {
            throw new StoreException(StoreException.Kind.FAILURE, "Failed to open SQLite store " + url, ex);
        }
    }

    private void init() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS resource (
                      id INTEGER PRIMARY KEY AUTOINCREMENT,
                      name TEXT NOT NULL UNIQUE,
                      category TEXT,
                      rarity TEXT,
                      description TEXT,
                      source_locations TEXT,
                      icon_path TEXT,
                      discovered INTEGER NOT NULL DEFAULT 0,
                      created_at TEXT,
                      updated_at TEXT
                    );
                """);
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS crafting_recipe (
                      id INTEGER PRIMARY KEY AUTOINCREMENT,
                      name TEXT NOT NULL UNIQUE,
                      description TEXT,
                      output_item_name TEXT NOT NULL,
                      output_quantity INTEGER NOT NULL DEFAULT 1 CHECK (output_quantity >= 1),
                      crafting_time_seconds INTEGER,
                      required_station TEXT,
                      skill_requirement TEXT,
                      icon_path TEXT,
                      discovered INTEGER NOT NULL DEFAULT 0,
                      created_at TEXT,
                      updated_at TEXT
                    );
                """);
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS recipe_ingredient (
                      id INTEGER PRIMARY KEY AUTOINCREMENT,
                      recipe_id INTEGER NOT NULL,
                      resource_id INTEGER NOT NULL,
                      quantity INTEGER NOT NULL CHECK (quantity > 0),
                      position INTEGER NOT NULL DEFAULT 0,
                      FOREIGN KEY (recipe_id) REFERENCES crafting_recipe(id) ON DELETE CASCADE,
                      FOREIGN KEY (resource_id) REFERENCES resource(id) ON DELETE CASCADE,
                      UNIQUE (recipe_id, resource_id)
                    );
                """);
            st.executeUpdate("""
                    CREATE INDEX IF NOT EXISTS idx_recipe_ingredient_recipe
                    ON recipe_ingredient(recipe_id, position);
                """);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new StoreException(StoreException.Kind.FAILURE, "Failed to close SQLite store", ex);
        }
    }

    // --- resources ---

    @Override
    public Optional<Resource> findResourceByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + RESOURCE_COLUMNS + " FROM resource WHERE name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readResource(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to look up resource '" + name + "'", ex);
        }
    }

    private Optional<Resource> findResourceById(long id) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + RESOURCE_COLUMNS + " FROM resource WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readResource(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to load resource " + id, ex);
        }
    }

    @Override
    public List<Resource> listResources() {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + RESOURCE_COLUMNS + " FROM resource ORDER BY name");
             ResultSet rs = ps.executeQuery()) {
            List<Resource> resources = new ArrayList<>();
            while (rs.next()) {
                resources.add(readResource(rs));
            }
            return resources;
        } catch (SQLException ex) {
            throw translate("Failed to list resources", ex);
        }
    }

    @Override
    public Resource createResource(ResourceRecord record) {
        String name = requireName(record.name());
        String now = now();
        try (PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO resource(name, category, rarity, description, source_locations, icon_path, discovered, created_at, updated_at)
                VALUES(?,?,?,?,?,?,?,?,?)
            """)) {
            ps.setString(1, name);
            ps.setString(2, record.category().orElse(null));
            ps.setString(3, record.rarity().orElse(null));
            ps.setString(4, record.description().orElse(null));
            ps.setString(5, record.sourceLocations().orElse(null));
            ps.setString(6, record.iconPath().orElse(null));
            ps.setInt(7, record.discovered().orElse(false) ? 1 : 0);
            ps.setString(8, now);
            ps.setString(9, now);
            ps.executeUpdate();
            long id = lastInsertId();
            LOG.debug("Inserted resource {} as #{}", name, id);
            return findResourceById(id).orElseThrow();
        } catch (SQLException ex) {
            throw translate("Failed to create resource '" + name + "'", ex);
        }
    }

    @Override
    public Resource updateResource(long id, ResourceRecord patch) {
        var update = new ColumnUpdate();
        patch.category().ifPresent(v -> update.text("category", v));
        patch.rarity().ifPresent(v -> update.text("rarity", v));
        patch.description().ifPresent(v -> update.text("description", v));
        patch.sourceLocations().ifPresent(v -> update.text("source_locations", v));
        patch.iconPath().ifPresent(v -> update.text("icon_path", v));
        patch.discovered().ifPresent(v -> update.flag("discovered", v));
        if (!update.isEmpty()) {
            update.text("updated_at", now());
            executeUpdate("resource", id, update);
        }
        return findResourceById(id)
            .orElseThrow(() -> new StoreException(StoreException.Kind.NOT_FOUND, "Resource " + id + " not found"));
    }

    @Override
    public Resource overwriteResource(long id, ResourceRecord record) {
        var update = new ColumnUpdate();
        update.text("category", record.category().orElse(null));
        update.text("rarity", record.rarity().orElse(null));
        update.text("description", record.description().orElse(null));
        update.text("source_locations", record.sourceLocations().orElse(null));
        update.text("icon_path", record.iconPath().orElse(null));
        update.flag("discovered", record.discovered().orElse(false));
        String now = now();
        update.text("created_at", now);
        update.text("updated_at", now);
        executeUpdate("resource", id, update);
        return findResourceById(id)
            .orElseThrow(() -> new StoreException(StoreException.Kind.NOT_FOUND, "Resource " + id + " not found"));
    }

    @Override
    public boolean deleteResource(long id) {
        return deleteRow("resource", id);
    }

    // --- recipes ---

    @Override
    public Optional<CraftingRecipe> findRecipeByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return findRecipe("name = ?", ps -> ps.setString(1, name));
    }

    private Optional<CraftingRecipe> findRecipeById(long id) {
        return findRecipe("id = ?", ps -> ps.setLong(1, id));
    }

    private Optional<CraftingRecipe> findRecipe(String where, Binder binder) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + RECIPE_COLUMNS + " FROM crafting_recipe WHERE " + where)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long id = rs.getLong("id");
                return Optional.of(readRecipe(rs, loadIngredients(id)));
            }
        } catch (SQLException ex) {
            throw translate("Failed to look up crafting recipe", ex);
        }
    }

    @Override
    public List<CraftingRecipe> listRecipes() {
        List<CraftingRecipe> recipes = new ArrayList<>();
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement("SELECT id FROM crafting_recipe ORDER BY name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong("id"));
            }
        } catch (SQLException ex) {
            throw translate("Failed to list crafting recipes", ex);
        }
        for (long id : ids) {
            findRecipeById(id).ifPresent(recipes::add);
        }
        return recipes;
    }

    @Override
    public CraftingRecipe createRecipe(RecipeRecord record, List<IngredientLink> ingredients) {
        String name = requireName(record.name());
        String outputItem = record.outputItemName()
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new StoreException(StoreException.Kind.FAILURE, "Recipe '" + name + "' has no output item name"));
        return inTransaction(store -> {
            String now = now();
            long id;
            try (PreparedStatement ps = connection.prepareStatement("""
                    INSERT INTO crafting_recipe(name, description, output_item_name, output_quantity, crafting_time_seconds,
                      required_station, skill_requirement, icon_path, discovered, created_at, updated_at)
                    VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """)) {
                ps.setString(1, name);
                ps.setString(2, record.description().orElse(null));
                ps.setString(3, outputItem);
                ps.setInt(4, record.outputQuantity().orElse(1));
                setNullableInt(ps, 5, record.craftingTimeSeconds().orElse(null));
                ps.setString(6, record.requiredStation().orElse(null));
                ps.setString(7, record.skillRequirement().orElse(null));
                ps.setString(8, record.iconPath().orElse(null));
                ps.setInt(9, record.discovered().orElse(false) ? 1 : 0);
                ps.setString(10, now);
                ps.setString(11, now);
                ps.executeUpdate();
                id = lastInsertId();
            } catch (SQLException ex) {
                throw translate("Failed to create crafting recipe '" + name + "'", ex);
            }
            insertIngredients(id, ingredients);
            LOG.debug("Inserted crafting recipe {} as #{} with {} ingredient(s)", name, id, ingredients.size());
            return findRecipeById(id).orElseThrow();
        });
    }

    @Override
    public CraftingRecipe updateRecipe(long id, RecipeRecord patch, Optional<List<IngredientLink>> ingredients) {
        return inTransaction(store -> {
            if (findRecipeById(id).isEmpty()) {
                throw new StoreException(StoreException.Kind.NOT_FOUND, "Crafting recipe " + id + " not found");
            }
            var update = new ColumnUpdate();
            patch.description().ifPresent(v -> update.text("description", v));
            patch.outputItemName().ifPresent(v -> update.text("output_item_name", v));
            patch.outputQuantity().ifPresent(v -> update.integer("output_quantity", v));
            patch.craftingTimeSeconds().ifPresent(v -> update.integer("crafting_time_seconds", v));
            patch.requiredStation().ifPresent(v -> update.text("required_station", v));
            patch.skillRequirement().ifPresent(v -> update.text("skill_requirement", v));
            patch.iconPath().ifPresent(v -> update.text("icon_path", v));
            patch.discovered().ifPresent(v -> update.flag("discovered", v));
            if (!update.isEmpty() || ingredients.isPresent()) {
                update.text("updated_at", now());
                executeUpdate("crafting_recipe", id, update);
            }
            if (ingredients.isPresent()) {
                try (PreparedStatement ps = connection.prepareStatement("DELETE FROM recipe_ingredient WHERE recipe_id = ?")) {
                    ps.setLong(1, id);
                    ps.executeUpdate();
                } catch (SQLException ex) {
                    throw translate("Failed to clear ingredients of crafting recipe " + id, ex);
                }
                insertIngredients(id, ingredients.get());
            }
            return findRecipeById(id).orElseThrow();
        });
    }

    @Override
    public boolean deleteRecipe(long id) {
        return deleteRow("crafting_recipe", id);
    }

    // --- transactions ---

    @Override
    public <T> T inTransaction(StoreWork<T> work) {
        boolean outermost;
        try {
            outermost = connection.getAutoCommit();
        } catch (SQLException ex) {
            throw translate("Failed to inspect transaction state", ex);
        }
        if (!outermost) {
            return work.run(this);
        }
        try {
            connection.setAutoCommit(false);
            T result = work.run(this);
            connection.commit();
            return result;
        } catch (SQLException ex) {
            rollback(ex);
            throw translate("Transaction failed", ex);
        } catch (RuntimeException ex) {
            rollback(ex);
            throw ex;
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException ex) {
                LOG.warn("Failed to restore auto-commit: {}", ex.getMessage());
            }
        }
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    // --- helpers ---

    private void insertIngredients(long recipeId, List<IngredientLink> ingredients) {
        if (ingredients == null || ingredients.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO recipe_ingredient(recipe_id, resource_id, quantity, position) VALUES(?,?,?,?)")) {
            int position = 0;
            for (IngredientLink link : ingredients) {
                ps.setLong(1, recipeId);
                ps.setLong(2, link.resourceId());
                ps.setInt(3, link.quantity());
                ps.setInt(4, position++);
                ps.executeUpdate();
            }
        } catch (SQLException ex) {
            throw translate("Failed to store ingredients of crafting recipe " + recipeId, ex);
        }
    }

    private List<Ingredient> loadIngredients(long recipeId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("""
                SELECT ri.id, ri.recipe_id, ri.resource_id, ri.quantity, ri.position, r.name AS resource_name
                FROM recipe_ingredient ri
                JOIN resource r ON r.id = ri.resource_id
                WHERE ri.recipe_id = ?
                ORDER BY ri.position, ri.id
            """)) {
            ps.setLong(1, recipeId);
            try (ResultSet rs = ps.executeQuery()) {
                List<Ingredient> ingredients = new ArrayList<>();
                while (rs.next()) {
                    ingredients.add(new Ingredient(
                        rs.getLong("id"),
                        rs.getLong("recipe_id"),
                        rs.getLong("resource_id"),
                        rs.getInt("quantity"),
                        rs.getInt("position"),
                        rs.getString("resource_name")
                    ));
                }
                return ingredients;
            }
        }
    }

    private void executeUpdate(String table, long id, ColumnUpdate update) {
        String sql = "UPDATE " + table + " SET " + update.assignments() + " WHERE id = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            int index = update.bind(ps);
            ps.setLong(index, id);
            if (ps.executeUpdate() == 0) {
                throw new StoreException(StoreException.Kind.NOT_FOUND, table + " " + id + " not found");
            }
        } catch (SQLException ex) {
            throw translate("Failed to update " + table + " " + id, ex);
        }
    }

    private boolean deleteRow(String table, long id) {
        try (PreparedStatement ps = connection.prepareStatement("DELETE FROM " + table + " WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            throw translate("Failed to delete " + table + " " + id, ex);
        }
    }

    private long lastInsertId() throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private String now() {
        return clock.instant().toString();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new StoreException(StoreException.Kind.FAILURE, "name is required");
        }
        return name;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Resource readResource(ResultSet rs) throws SQLException {
        return new Resource(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("category"),
            rs.getString("rarity"),
            rs.getString("description"),
            rs.getString("source_locations"),
            rs.getString("icon_path"),
            rs.getInt("discovered") != 0,
            rs.getString("created_at"),
            rs.getString("updated_at")
        );
    }

    private static CraftingRecipe readRecipe(ResultSet rs, List<Ingredient> ingredients) throws SQLException {
        int time = rs.getInt("crafting_time_seconds");
        Integer craftingTime = rs.wasNull() ? null : time;
        return new CraftingRecipe(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("output_item_name"),
            rs.getInt("output_quantity"),
            craftingTime,
            rs.getString("required_station"),
            rs.getString("skill_requirement"),
            rs.getString("icon_path"),
            rs.getInt("discovered") != 0,
            ingredients,
            rs.getString("created_at"),
            rs.getString("updated_at")
        );
    }

    static StoreException translate(String context, SQLException ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage();
        StoreException.Kind kind;
        if (message.contains("UNIQUE constraint failed: recipe_ingredient")) {
            kind = StoreException.Kind.FAILURE;
        } else if (message.contains("UNIQUE constraint failed")) {
            kind = StoreException.Kind.DUPLICATE_NAME;
        } else if (message.contains("FOREIGN KEY constraint failed")) {
            kind = StoreException.Kind.MISSING_REFERENCE;
        } else {
            kind = StoreException.Kind.FAILURE;
        }
        return new StoreException(kind, context + ": " + message, ex);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /** Collects {@code column = ?} assignments for a partial update. */
    private static final class ColumnUpdate {
        private final List<String> columns = new ArrayList<>();
        private final List<Object> values = new ArrayList<>();

        void text(String column, String value) {
            columns.add(column);
            values.add(value);
        }

        void integer(String column, Integer value) {
            columns.add(column);
            values.add(value);
        }

        void flag(String column, boolean value) {
            columns.add(column);
            values.add(value ? 1 : 0);
        }

        boolean isEmpty() {
            return columns.isEmpty();
        }

        String assignments() {
            return String.join(", ", columns.stream().map(c -> c + " = ?").toList());
        }

        int bind(PreparedStatement ps) throws SQLException {
            int index = 1;
            for (Object value : values) {
                if (value == null) {
                    ps.setNull(index++, Types.NULL);
                } else if (value instanceof Integer number) {
                    ps.setInt(index++, number);
                } else {
                    ps.setString(index++, value.toString());
                }
            }
            return index;
        }
    }
}
