package com.pgcrond.core;

import java.util.Objects;

/**
 * One parsed line of the job table.
 *
 * <p>A job entry describes a schedule (the five-field timespec), a database
 * target (server, port, database, user and schema fields, each possibly the
 * {@link #PLACEHOLDER} meaning "inherit the default"), a job type keyword and a
 * command. Entries are built fresh from the table on every tick and never
 * change after construction.</p>
 *
 * <p>The type is kept as the raw keyword from the file; {@link #getJobType()}
 * maps it onto {@link JobType} and returns null for unknown keywords.</p>
 *
 * @see com.pgcrond.crontab.JobTableParser
 */
public final class JobEntry {
    /** Field value meaning "use the default from the variable set". */
    public static final String PLACEHOLDER = "-";

    private final int lineNumber;
    private final String timespec;
    private final String server;
    private final String port;
    private final String database;
    private final String user;
    private final String schema;
    private final String type;
    private final String command;

    public JobEntry(int lineNumber, String timespec, String server, String port, String database,
                    String user, String schema, String type, String command) {
        this.lineNumber = lineNumber;
        this.timespec = Objects.requireNonNull(timespec, "timespec");
        this.server = Objects.requireNonNull(server, "server");
        this.port = Objects.requireNonNull(port, "port");
        this.database = Objects.requireNonNull(database, "database");
        this.user = Objects.requireNonNull(user, "user");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.type = Objects.requireNonNull(type, "type");
        this.command = Objects.requireNonNull(command, "command");
    }

    /**
     * Get the 1-based line of the job table this entry was parsed from.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Get the five timespec fields joined by single spaces.
     */
    public String getTimespec() {
        return timespec;
    }

    public String getServer() {
        return server;
    }

    public String getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public String getSchema() {
        return schema;
    }

    /**
     * Get the type keyword exactly as written in the table.
     */
    public String getType() {
        return type;
    }

    /**
     * Get the job type for this entry.
     *
     * @return the type, or null if the keyword is not one of direct, psql, perl or sh
     */
    public JobType getJobType() {
        return JobType.fromKeyword(type);
    }

    public String getCommand() {
        return command;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobEntry)) {
            return false;
        }
        JobEntry other = (JobEntry) o;
        return lineNumber == other.lineNumber
                && timespec.equals(other.timespec)
                && server.equals(other.server)
                && port.equals(other.port)
                && database.equals(other.database)
                && user.equals(other.user)
                && schema.equals(other.schema)
                && type.equals(other.type)
                && command.equals(other.command);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, timespec, server, port, database, user, schema, type, command);
    }

    @Override
    public String toString() {
        return "JobEntry{line=" + lineNumber + ", timespec='" + timespec + "', type='" + type
                + "', command='" + command + "'}";
    }
}
