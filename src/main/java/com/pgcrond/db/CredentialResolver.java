package com.pgcrond.db;

import com.pgcrond.core.CredentialException;
import com.pgcrond.core.JobEntry;
import com.pgcrond.core.ResolvedDsn;
import com.pgcrond.core.VariableSet;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Resolves the connection target and password for a job entry.
 *
 * <p><b>Resolution Steps:</b></p>
 * <ol>
 *   <li>Each DSN field written as {@code -} takes the matching non-empty
 *       {@code PGHOST/PGPORT/PGDATABASE/PGUSER} variable, otherwise stays unresolved</li>
 *   <li>An unresolved database or user makes the job unrunnable</li>
 *   <li>The schema field becomes an ordered list; a trailing comma appends
 *       {@code public} unless already listed</li>
 *   <li>The server defaults to {@code localhost}; the port may stay absent</li>
 *   <li>The password store is located (configured path, else {@code ~/.pgpass})
 *       and scanned; the first matching line supplies the password</li>
 * </ol>
 *
 * <p>Steps 1 to 4 never fail. Step 5 throws {@link CredentialException} when the
 * store cannot be found or read, which the execution reports to the job's
 * recipient. A store without a matching line is not an error: the job proceeds
 * without a password.</p>
 *
 * <p>The resolved {@code PG*} values reach the job through
 * {@link VariableSet#withResolvedDsn(ResolvedDsn)}; the input set is never modified.</p>
 *
 * @see PasswordStore
 */
public class CredentialResolver {
    private static final Logger logger = Logger.getLogger(CredentialResolver.class.getName());

    public static final String PASSWORD_FILE_NAME = ".pgpass";
    private static final String IMPLICIT_SCHEMA = "public";

    private final Path configuredStore;
    private final Supplier<String> homeDirectory;

    /**
     * Create a resolver that reads {@code ~/.pgpass} of the invoking user.
     */
    public CredentialResolver() {
        this(null);
    }

    /**
     * Create a resolver with an explicit password store.
     *
     * @param configuredStore the password file, or null to use {@code ~/.pgpass}
     */
    public CredentialResolver(Path configuredStore) {
        this(configuredStore, () -> System.getProperty("user.home"));
    }

    /**
     * Create a resolver with an explicit home directory lookup.
     *
     * @param configuredStore the password file, or null to derive it from the home directory
     * @param homeDirectory supplies the invoking user's home directory, null if unknown
     */
    public CredentialResolver(Path configuredStore, Supplier<String> homeDirectory) {
        this.configuredStore = configuredStore;
        this.homeDirectory = homeDirectory;
    }

    /**
     * Get the explicitly configured password store, or null when {@code ~/.pgpass} is used.
     */
    public Path getConfiguredStore() {
        return configuredStore;
    }

    /**
     * Resolve the DSN and password for an entry.
     *
     * @param variables the tick's variables
     * @param entry the job entry
     * @return the DSN with password (when found), or empty if the job is unrunnable
     * @throws CredentialException if the password store cannot be located or read
     */
    public Optional<ResolvedDsn> resolve(VariableSet variables, JobEntry entry) throws CredentialException {
        Optional<ResolvedDsn> dsn = resolveDsn(variables, entry);
        if (dsn.isEmpty()) {
            return dsn;
        }
        return Optional.of(resolvePassword(dsn.get()));
    }

    /**
     * Resolve the connection target of an entry, without touching the password store.
     *
     * @return the DSN, or empty if database or user cannot be resolved
     */
    public Optional<ResolvedDsn> resolveDsn(VariableSet variables, JobEntry entry) {
        String server = inherit(entry.getServer(), variables, VariableSet.PGHOST);
        String port = inherit(entry.getPort(), variables, VariableSet.PGPORT);
        String database = inherit(entry.getDatabase(), variables, VariableSet.PGDATABASE);
        String user = inherit(entry.getUser(), variables, VariableSet.PGUSER);

        if (database == null || user == null) {
            logger.fine("Line " + entry.getLineNumber() + " has no database or user, job is unrunnable");
            return Optional.empty();
        }

        return Optional.of(new ResolvedDsn(server, port, database, user, parseSchemas(entry.getSchema()), null));
    }

    /**
     * Look up the password for a DSN in the password store.
     *
     * @return a copy of the DSN carrying the password, or the DSN unchanged when no line matches
     * @throws CredentialException if the store cannot be located or read
     */
    public ResolvedDsn resolvePassword(ResolvedDsn dsn) throws CredentialException {
        PasswordStore store = new PasswordStore(locateStore());
        Optional<String> password = store.lookup(
                dsn.getServer(), dsn.getPort().orElse(null), dsn.getDatabase(), dsn.getUsername());
        if (password.isEmpty()) {
            logger.fine("No password entry for " + dsn + " in " + store.getFile());
            return dsn;
        }
        return dsn.withPassword(password.get());
    }

    /**
     * Split a schema field into the ordered search path.
     *
     * <p>{@code "-"} yields an empty list. {@code "a,b,"} yields {@code [a, b, public]};
     * {@code "public,a"} is kept as written.</p>
     */
    public static List<String> parseSchemas(String field) {
        List<String> schemas = new ArrayList<>();
        if (field == null || JobEntry.PLACEHOLDER.equals(field)) {
            return schemas;
        }
        for (String name : field.split(",")) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                schemas.add(trimmed);
            }
        }
        if (field.trim().endsWith(",") && !schemas.contains(IMPLICIT_SCHEMA)) {
            schemas.add(IMPLICIT_SCHEMA);
        }
        return schemas;
    }

    private Path locateStore() throws CredentialException {
        if (configuredStore != null) {
            return configuredStore;
        }
        String home = homeDirectory.get();
        if (home == null || home.isBlank()) {
            throw new CredentialException("Unable to determine home directory for password file");
        }
        return Path.of(home, PASSWORD_FILE_NAME);
    }

    // Returns null when the field stays unresolved
    private static String inherit(String field, VariableSet variables, String variable) {
        if (!JobEntry.PLACEHOLDER.equals(field)) {
            return field;
        }
        return variables.isSet(variable) ? variables.get(variable) : null;
    }
}
