package com.pgcrond.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully resolved connection target for one job.
 *
 * <p>Database and user are always present; a DSN missing either is never
 * built (the job is unrunnable). The server defaults to {@link #DEFAULT_SERVER};
 * the port and the password are optional. Schemas are the ordered search path
 * requested by the job, empty when the job inherits the server default.</p>
 *
 * <p>Instances are immutable. {@link #withPassword(String)} returns a copy.</p>
 */
public final class ResolvedDsn {
    public static final String DEFAULT_SERVER = "localhost";

    private final String server;
    private final String port;
    private final String database;
    private final String username;
    private final List<String> schemas;
    private final String password;

    public ResolvedDsn(String server, String port, String database, String username,
                       List<String> schemas, String password) {
        this.server = server == null ? DEFAULT_SERVER : server;
        this.port = port;
        this.database = Objects.requireNonNull(database, "database");
        this.username = Objects.requireNonNull(username, "username");
        this.schemas = schemas == null ? List.of() : List.copyOf(schemas);
        this.password = password;
    }

    public String getServer() {
        return server;
    }

    public Optional<String> getPort() {
        return Optional.ofNullable(port);
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    /**
     * Get the schema search path requested by the job.
     *
     * @return an unmodifiable list, empty when no schema override was given
     */
    public List<String> getSchemas() {
        return schemas;
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    /**
     * Return a copy of this DSN carrying the given password.
     *
     * @param password the password, or null for none
     */
    public ResolvedDsn withPassword(String password) {
        return new ResolvedDsn(server, port, database, username, schemas, password);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedDsn)) {
            return false;
        }
        ResolvedDsn other = (ResolvedDsn) o;
        return server.equals(other.server)
                && Objects.equals(port, other.port)
                && database.equals(other.database)
                && username.equals(other.username)
                && schemas.equals(other.schemas)
                && Objects.equals(password, other.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(server, port, database, username, schemas, password);
    }

    // Never prints the password
    @Override
    public String toString() {
        return username + "@" + server + (port == null ? "" : ":" + port) + "/" + database
                + (schemas.isEmpty() ? "" : " " + schemas);
    }
}
