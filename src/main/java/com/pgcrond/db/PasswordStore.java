package com.pgcrond.db;

import com.pgcrond.core.CredentialException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sequential, wildcard-matching password file in the libpq {@code .pgpass} format.
 *
 * <p>Each line reads {@code host:port:database:user:password}. Any of the first four
 * fields may be {@code *}. Lines are scanned top to bottom and the first line whose
 * four fields all match wins; later lines are never read, even when they are more
 * specific. {@code \:} and {@code \\} escape a literal colon or backslash. Blank
 * lines, {@code #} comments and lines with fewer than five fields are skipped.</p>
 *
 * <p>File permissions are a deployment concern and are not checked here.</p>
 */
public class PasswordStore {
    private static final String WILDCARD = "*";
    private static final int FIELD_COUNT = 5;

    private final Path file;

    public PasswordStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Find the password for a connection target.
     *
     * @param host the resolved server
     * @param port the resolved port, or null when the job has none
     * @param database the resolved database
     * @param user the resolved user
     * @return the password of the first matching line, or empty if no line matches
     * @throws CredentialException if the file cannot be opened, read or closed
     */
    public Optional<String> lookup(String host, String port, String database, String user)
            throws CredentialException {
        String[] wanted = {host, port, database, user};
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                List<String> fields = splitFields(line);
                if (fields.size() < FIELD_COUNT) {
                    continue;
                }
                if (matches(fields, wanted)) {
                    return Optional.of(fields.get(4));
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new CredentialException("Unable to read password file " + file + ": " + e.getMessage(), e);
        }
    }

    private static boolean matches(List<String> fields, String[] wanted) {
        for (int i = 0; i < wanted.length; i++) {
            String field = fields.get(i);
            if (!WILDCARD.equals(field) && !field.equals(wanted[i])) {
                return false;
            }
        }
        return true;
    }

    // The fifth field takes the rest of the line, colons included
    static List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>(FIELD_COUNT);
        StringBuilder current = new StringBuilder();
        boolean escaped = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == ':' && fields.size() < FIELD_COUNT - 1) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
