package br.edu.ifba.cadgraph.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for SQLiteSchemaMigrator.
 *
 * Tests verify:
 * 1. Schema version tracking works correctly
 * 2. Initial migration creates the graph tables
 * 3. Already applied migrations are skipped
 */
class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteSchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        migrator = new SQLiteSchemaMigrator();
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Test
    void testGetCurrentVersionReturnsZeroForNewDatabase() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            assertEquals(0, migrator.getCurrentVersion(conn), "New database should have version 0");
        }
    }

    @Test
    void testMigrateCreatesGraphTables() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);

            Set<String> tables = new HashSet<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT name FROM sqlite_master WHERE type='table'")) {
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
            }
            assertTrue(tables.containsAll(Set.of("graph_nodes", "graph_relationships", "schema_version")),
                "Missing tables in " + tables);
            assertEquals(1, migrator.getCurrentVersion(conn));
        }
    }

    @Test
    void testMigrateIsIdempotent() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);
            migrator.migrateToLatest(conn);

            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                rs.next();
                assertEquals(1, rs.getInt(1), "Each version is recorded once");
            }
        }
    }

    @Test
    void testStatementSplitting() {
        List<String> statements = SQLiteSchemaMigrator.ResourceMigration.statements("""
            -- comment
            CREATE TABLE a (
                id INTEGER
            );

            CREATE INDEX i ON a (id);
            """);

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE a"));
        assertEquals("CREATE INDEX i ON a (id)", statements.get(1));
    }
}
