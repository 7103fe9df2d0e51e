package br.edu.ifba.cadgraph.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the graph schema migrations on startup.
 *
 * <p>Migrations are SQL files on the classpath under {@code /db/migrations/},
 * named {@code V{version}__{description}.sql} and applied in version order.
 * Applied versions are recorded in {@code schema_version}.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new ResourceMigration(1, "Graph node and relationship tables", MIGRATION_PATH + "V001__graph_schema.sql"));
    }

    /**
     * Gets current schema version from database.
     *
     * @param conn database connection
     * @return current version number, 0 if not initialized
     * @throws SQLException if the version table cannot be read
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                if (!rs.wasNull()) {
                    return version;
                }
            }
        }
        return 0;
    }

    /**
     * Applies all pending migrations in one transaction.
     *
     * @param conn database connection
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current graph schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            ensureVersionTable(conn);

            for (Migration migration : migrations) {
                if (migration.getVersion() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.getVersion(), migration.getDescription());
                    migration.apply(conn);
                    recordVersion(conn, migration);
                }
            }

            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void ensureVersionTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    description TEXT NOT NULL,
                    applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                )
                """);
        }
    }

    private void recordVersion(Connection conn, Migration migration) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
            stmt.setInt(1, migration.getVersion());
            stmt.setString(2, migration.getDescription());
            stmt.executeUpdate();
        }
    }

    /**
     * A single schema migration.
     */
    public interface Migration {

        int getVersion();

        String getDescription();

        void apply(Connection conn) throws SQLException;
    }

    /**
     * Migration that loads SQL from a classpath resource.
     * Statements are separated by semicolons at end of line; {@code --} comment lines are ignored.
     */
    static final class ResourceMigration implements Migration {

        private final int version;
        private final String description;
        private final String resourcePath;

        ResourceMigration(int version, String description, String resourcePath) {
            this.version = version;
            this.description = description;
            this.resourcePath = resourcePath;
        }

        @Override
        public int getVersion() {
            return version;
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : statements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(60, statement.length())));
                    stmt.execute(statement);
                }
            }
        }

        static List<String> statements(String sql) {
            List<String> statements = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String line : sql.split("\n")) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                    continue;
                }
                current.append(line).append('\n');
                if (trimmed.endsWith(";")) {
                    String statement = current.toString().trim();
                    statements.add(statement.substring(0, statement.length() - 1).trim());
                    current.setLength(0);
                }
            }
            if (!current.toString().isBlank()) {
                statements.add(current.toString().trim());
            }
            return statements;
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }

            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }
}
