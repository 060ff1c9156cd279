package com.pgcrond.db;

import com.pgcrond.core.ResolvedDsn;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens database connections for a resolved DSN.
 */
@FunctionalInterface
public interface DbConnector {

    /**
     * Open a new connection.
     *
     * <p>The connection is returned in autocommit mode; the caller decides whether
     * to start a transaction and must close the connection.</p>
     *
     * @param dsn the connection target, with password when one was found
     * @return an open connection
     * @throws SQLException if the database rejects the connection
     */
    Connection connect(ResolvedDsn dsn) throws SQLException;
}
