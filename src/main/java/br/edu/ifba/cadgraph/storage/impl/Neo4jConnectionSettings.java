package br.edu.ifba.cadgraph.storage.impl;

import java.time.Duration;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Connection parameters of a Neo4j graph store.
 *
 * @param uri bolt or neo4j URI, e.g. {@code bolt://localhost:7687}
 * @param username principal
 * @param password credential
 * @param database target database, or null for the server default
 * @param connectionTimeout bound on establishing a connection
 * @param transactionTimeout server-side bound on a single transaction
 */
public record Neo4jConnectionSettings(
    String uri,
    String username,
    String password,
    @Nullable String database,
    Duration connectionTimeout,
    Duration transactionTimeout
) {

    public Neo4jConnectionSettings {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(password, "password must not be null");
        Objects.requireNonNull(connectionTimeout, "connectionTimeout must not be null");
        Objects.requireNonNull(transactionTimeout, "transactionTimeout must not be null");
    }

    @Override
    public String toString() {
        // keeps the credential out of logs
        return "Neo4jConnectionSettings[uri=" + uri + ", username=" + username + ", database=" + database + "]";
    }
}
