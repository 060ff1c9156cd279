package com.pgcrond.db;

import com.pgcrond.core.ResolvedDsn;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

// Opens one unpooled PostgreSQL connection per job
public class JdbcConnector implements DbConnector {
    private static final String APPLICATION_NAME = "pgcrond";
    private static final int CONNECT_TIMEOUT_SECONDS = 30;

    @Override
    public Connection connect(ResolvedDsn dsn) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", dsn.getUsername());
        dsn.getPassword().ifPresent(password -> props.setProperty("password", password));
        props.setProperty("ApplicationName", APPLICATION_NAME);
        props.setProperty("connectTimeout", String.valueOf(CONNECT_TIMEOUT_SECONDS));

        // pgjdbc turns currentSchema into the session search_path
        if (!dsn.getSchemas().isEmpty()) {
            props.setProperty("currentSchema", String.join(",", dsn.getSchemas()));
        }

        return DriverManager.getConnection(buildUrl(dsn), props);
    }

    // jdbc:postgresql://host[:port]/database
    public static String buildUrl(ResolvedDsn dsn) {
        StringBuilder url = new StringBuilder("jdbc:postgresql://").append(dsn.getServer());
        dsn.getPort().ifPresent(port -> url.append(':').append(port));
        url.append('/').append(dsn.getDatabase());
        return url.toString();
    }
}
