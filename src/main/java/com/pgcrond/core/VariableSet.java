package com.pgcrond.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of variables assigned in the job table.
 *
 * <p>Variables are scoped to one parse of the table: the scheduler takes a fresh
 * set on every tick and each dispatched job receives it as part of its snapshot.
 * Credential resolution never mutates the set it was given; it derives a new set
 * with {@link #withResolvedDsn(ResolvedDsn)} which only the job's own context sees.</p>
 *
 * <p><b>Invariant:</b> {@link #PGPASSWORD} is never present. Passwords come from the
 * password store only.</p>
 */
public final class VariableSet {
    public static final String PGHOST = "PGHOST";
    public static final String PGPORT = "PGPORT";
    public static final String PGDATABASE = "PGDATABASE";
    public static final String PGUSER = "PGUSER";
    public static final String PGPASSWORD = "PGPASSWORD";
    public static final String PGPASSFILE = "PGPASSFILE";
    public static final String MAILTO = "MAILTO";
    public static final String MAILFROM = "MAILFROM";
    public static final String DSN_IN_MAIL = "DSN_IN_MAIL";
    public static final String SCRIPTHOME = "SCRIPTHOME";
    public static final String PSQL = "PSQL";

    public static final String DEFAULT_MAILTO = "root";
    public static final String DEFAULT_MAILFROM = "pgcrond";
    public static final String DEFAULT_SCRIPTHOME = "/etc/pgcrond/scripts/";
    public static final String DEFAULT_PSQL = "/usr/bin/psql";

    private static final Set<String> FALSY = Set.of("0", "off", "no");

    private final Map<String, String> values;

    public VariableSet(Map<String, String> values) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.remove(PGPASSWORD);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static VariableSet empty() {
        return new VariableSet(Map.of());
    }

    /**
     * Get a variable's value.
     *
     * @return the value, or null if the variable was never assigned
     */
    public String get(String name) {
        return values.get(name);
    }

    /**
     * Get a variable's value, falling back when it is unset or empty.
     */
    public String getOrDefault(String name, String fallback) {
        String value = values.get(name);
        return value == null || value.isEmpty() ? fallback : value;
    }

    /**
     * Check whether a variable holds a non-empty value.
     */
    public boolean isSet(String name) {
        String value = values.get(name);
        return value != null && !value.isEmpty();
    }

    /**
     * Interpret a boolean-like variable.
     *
     * <p>Only {@code 0}, {@code off} and {@code no} (any case) are false; an unset
     * variable yields {@code fallback}.</p>
     */
    public boolean isTrue(String name, boolean fallback) {
        String value = values.get(name);
        if (value == null) {
            return fallback;
        }
        return !FALSY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Derive the variables a job sees once its DSN is resolved.
     *
     * <p>The connection variables are replaced by the resolved values. A field the
     * DSN does not carry (only the port can be missing) is removed rather than left
     * over from the table defaults. This set is not modified.</p>
     *
     * @param dsn the job's resolved DSN
     * @return a new variable set
     */
    public VariableSet withResolvedDsn(ResolvedDsn dsn) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(PGHOST, dsn.getServer());
        if (dsn.getPort().isPresent()) {
            copy.put(PGPORT, dsn.getPort().get());
        } else {
            copy.remove(PGPORT);
        }
        copy.put(PGDATABASE, dsn.getDatabase());
        copy.put(PGUSER, dsn.getUsername());
        return new VariableSet(copy);
    }

    /**
     * Get the variables as an unmodifiable map in assignment order.
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VariableSet && values.equals(((VariableSet) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "VariableSet" + values;
    }
}
