package com.pgcrond.crontab;

import com.pgcrond.core.JobEntry;
import com.pgcrond.core.VariableSet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the job table into variables and job entries.
 *
 * <p><b>Line Grammar:</b></p>
 * <ul>
 *   <li>Anything from {@code #} to the end of a line is a comment</li>
 *   <li>Blank lines are skipped</li>
 *   <li>{@code NAME = value} assigns a variable; the value is trimmed and one pair
 *       of surrounding double quotes is removed</li>
 *   <li>Every other line is a job:
 *       {@code min hour dom month dow server port database user schema type command...}</li>
 * </ul>
 *
 * <p>Variables are not positional: the last assignment to a name wins for every
 * job in the table, including jobs written above it. Job lines with fewer than
 * twelve fields are dropped without error.</p>
 *
 * <p>Once the whole table is read, {@code PGPASSWORD} is discarded, {@code SCRIPTHOME}
 * gets a trailing separator, and {@code MAILTO}, {@code MAILFROM}, {@code PSQL} and
 * {@code SCRIPTHOME} receive their defaults when unset or empty.</p>
 *
 * <p><b>Thread Safety:</b> The parser is stateless and can be shared.</p>
 */
public class JobTableParser {
    private static final Logger logger = Logger.getLogger(JobTableParser.class.getName());

    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_FIELDS = 12;
    private static final int TIMESPEC_FIELDS = 5;

    /**
     * Read and parse a job table file.
     *
     * @param file the job table
     * @return the parsed table
     * @throws IOException if the file cannot be opened or read
     */
    public JobTable parse(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * Parse job table content given as text.
     */
    public JobTable parse(String content) {
        return parse(content.lines().toList());
    }

    /**
     * Parse job table content given as lines.
     */
    public JobTable parse(List<String> lines) {
        Map<String, String> variables = new LinkedHashMap<>();
        List<JobEntry> entries = new ArrayList<>();

        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }

            Matcher assignment = ASSIGNMENT.matcher(line);
            if (assignment.matches()) {
                variables.put(assignment.group(1), unquote(assignment.group(2).trim()));
                continue;
            }

            String[] tokens = WHITESPACE.split(line);
            if (tokens.length < MIN_FIELDS) {
                logger.fine("Dropping line " + lineNumber + ": only " + tokens.length + " fields");
                continue;
            }
            entries.add(toEntry(lineNumber, tokens));
        }

        applyDefaults(variables);
        return new JobTable(new VariableSet(variables), entries);
    }

    private static JobEntry toEntry(int lineNumber, String[] tokens) {
        String timespec = String.join(" ", Arrays.copyOfRange(tokens, 0, TIMESPEC_FIELDS));
        String command = String.join(" ", Arrays.copyOfRange(tokens, MIN_FIELDS - 1, tokens.length));
        return new JobEntry(lineNumber, timespec,
                tokens[5], tokens[6], tokens[7], tokens[8], tokens[9], tokens[10], command);
    }

    private static void applyDefaults(Map<String, String> variables) {
        variables.remove(VariableSet.PGPASSWORD);

        String scriptHome = variables.get(VariableSet.SCRIPTHOME);
        if (scriptHome == null || scriptHome.isEmpty()) {
            scriptHome = VariableSet.DEFAULT_SCRIPTHOME;
        }
        if (!scriptHome.endsWith("/")) {
            scriptHome = scriptHome + "/";
        }
        variables.put(VariableSet.SCRIPTHOME, scriptHome);

        putDefault(variables, VariableSet.MAILTO, VariableSet.DEFAULT_MAILTO);
        putDefault(variables, VariableSet.MAILFROM, VariableSet.DEFAULT_MAILFROM);
        putDefault(variables, VariableSet.PSQL, VariableSet.DEFAULT_PSQL);
    }

    private static void putDefault(Map<String, String> variables, String name, String fallback) {
        String value = variables.get(name);
        if (value == null || value.isEmpty()) {
            variables.put(name, fallback);
        }
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
