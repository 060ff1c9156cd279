package com.pgcrond.core;

import com.pgcrond.db.DbConnector;
import com.pgcrond.exec.ProcessRunner;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Context information for executing one job, handed to its {@link com.pgcrond.jobs.JobHandler}.
 *
 * <p>This class is the bridge between a job body and the daemon. It carries:</p>
 * <ul>
 *   <li>The job entry being executed</li>
 *   <li>The resolved DSN, password included when the store had one</li>
 *   <li>The job's own variable set, with {@code PG*} rewritten to the resolved DSN</li>
 *   <li>The configured password file, if any, for clients that authenticate on their own</li>
 *   <li>Access to database connections and subprocesses</li>
 * </ul>
 *
 * <p><b>Isolation:</b> A context belongs to a single execution. Nothing a handler
 * derives from it is visible to sibling jobs of the same tick.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * public String execute(JobContext context) throws JobFailedException {
 *     Path file = context.resolveScriptPath();
 *     try (Connection conn = context.openConnection()) {
 *         // ... run the job body
 *     }
 * }
 * }</pre>
 *
 * @see com.pgcrond.jobs.JobHandler#execute(JobContext)
 */
public class JobContext {
    private final JobEntry entry;
    private final ResolvedDsn dsn;
    private final VariableSet variables;
    private final DbConnector connector;
    private final ProcessRunner processRunner;
    private final Path passwordFile;

    /**
     * Create a context for one job.
     *
     * @param entry the job table entry
     * @param dsn the resolved connection target
     * @param variables the variables seen by this job (already rewritten for the DSN)
     * @param connector opens database connections for the DSN
     * @param processRunner runs psql and shell subprocesses
     */
    public JobContext(JobEntry entry, ResolvedDsn dsn, VariableSet variables,
                      DbConnector connector, ProcessRunner processRunner) {
        this(entry, dsn, variables, connector, processRunner, null);
    }

    /**
     * Create a context for one job whose credentials came from an explicit password file.
     *
     * @param passwordFile the configured password file, or null when libpq's default applies
     */
    public JobContext(JobEntry entry, ResolvedDsn dsn, VariableSet variables,
                      DbConnector connector, ProcessRunner processRunner, Path passwordFile) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.dsn = Objects.requireNonNull(dsn, "dsn");
        this.variables = Objects.requireNonNull(variables, "variables");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
        this.passwordFile = passwordFile;
    }

    public JobEntry getEntry() {
        return entry;
    }

    public ResolvedDsn getDsn() {
        return dsn;
    }

    public VariableSet getVariables() {
        return variables;
    }

    public ProcessRunner getProcessRunner() {
        return processRunner;
    }

    /**
     * Get the configured password file, or null when none was configured.
     */
    public Path getPasswordFile() {
        return passwordFile;
    }

    /**
     * Open a new database connection to the job's DSN.
     *
     * <p>The caller owns the connection and must close it.</p>
     *
     * @throws SQLException if the connection cannot be established
     */
    public Connection openConnection() throws SQLException {
        return connector.connect(dsn);
    }

    /**
     * Resolve the job's command as a file path.
     *
     * <p>Absolute commands are used as-is; anything else is relative to
     * {@code SCRIPTHOME}, which always ends with a separator.</p>
     */
    public Path resolveScriptPath() {
        String command = entry.getCommand();
        if (command.startsWith("/")) {
            return Path.of(command);
        }
        return Path.of(variables.getOrDefault(VariableSet.SCRIPTHOME, VariableSet.DEFAULT_SCRIPTHOME) + command);
    }

    @Override
    public String toString() {
        return "JobContext{line=" + entry.getLineNumber() + ", dsn=" + dsn + "}";
    }
}
