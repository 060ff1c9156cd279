package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.Logger;

// Job that runs its command as a single SQL statement inside a transaction
public class DirectJob implements JobHandler {
    private static final Logger logger = Logger.getLogger(DirectJob.class.getName());

    @Override
    public String execute(JobContext context) throws JobFailedException {
        Connection conn;
        try {
            conn = context.openConnection();
        } catch (SQLException e) {
            throw new JobFailedException("Unable to connect to database: " + e.getMessage(), e);
        }

        try (conn) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(context.getEntry().getCommand());
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw new JobFailedException("Error performing SQL operation: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            // setAutoCommit or close failed
            throw new JobFailedException("Error performing SQL operation: " + e.getMessage(), e);
        }
        return "";
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Rollback failed", e);
        }
    }
}
