package com.pgcrond.engine;

import com.pgcrond.core.JobEntry;
import com.pgcrond.core.ResolvedDsn;
import com.pgcrond.core.VariableSet;
import com.pgcrond.notify.Notifier;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles a job report and sends it to the job table's {@code MAILTO}.
 *
 * <p>Unless {@code DSN_IN_MAIL} is {@code 0}, {@code off} or {@code no}, the message
 * starts with a fixed-width banner naming the connection target:</p>
 * <pre>
 * Server:   db1.example.com
 * Port:     5433
 * Database: sales
 * User:     batch
 * Schemas:  reporting, public
 *
 * ...message...
 * </pre>
 *
 * <p>Port and schemas lines are left out when the job has none. The subject carries
 * the job's command so recipients can tell jobs apart.</p>
 */
public class Reporter {
    private static final Logger logger = Logger.getLogger(Reporter.class.getName());

    private static final int SUBJECT_COMMAND_LENGTH = 60;

    private final Notifier notifier;

    public Reporter(Notifier notifier) {
        this.notifier = notifier;
    }

    /**
     * Send a report for a job.
     *
     * <p>Delivery problems are logged, never thrown: a report that cannot be sent must
     * not turn into a second failure of the job.</p>
     *
     * @param variables the job's variables (recipient, sender and banner switch)
     * @param entry the job entry
     * @param dsn the job's connection target, or null when it could not be resolved
     * @param message the report text
     * @return true if the notifier accepted the message
     */
    public boolean report(VariableSet variables, JobEntry entry, ResolvedDsn dsn, String message) {
        String to = variables.getOrDefault(VariableSet.MAILTO, VariableSet.DEFAULT_MAILTO);
        String from = variables.getOrDefault(VariableSet.MAILFROM, VariableSet.DEFAULT_MAILFROM);
        String subject = buildSubject(entry);

        StringBuilder body = new StringBuilder();
        if (dsn != null && variables.isTrue(VariableSet.DSN_IN_MAIL, true)) {
            body.append(buildBanner(dsn)).append('\n');
        }
        body.append(message);

        try {
            notifier.send(from, to, subject, body.toString());
            return true;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to send report for line " + entry.getLineNumber() + " to " + to, e);
            return false;
        }
    }

    public static String buildBanner(ResolvedDsn dsn) {
        StringBuilder banner = new StringBuilder();
        line(banner, "Server:", dsn.getServer());
        dsn.getPort().ifPresent(port -> line(banner, "Port:", port));
        line(banner, "Database:", dsn.getDatabase());
        line(banner, "User:", dsn.getUsername());
        if (!dsn.getSchemas().isEmpty()) {
            line(banner, "Schemas:", String.join(", ", dsn.getSchemas()));
        }
        return banner.toString();
    }

    public static String buildSubject(JobEntry entry) {
        String command = entry.getCommand();
        if (command.length() > SUBJECT_COMMAND_LENGTH) {
            command = command.substring(0, SUBJECT_COMMAND_LENGTH - 3) + "...";
        }
        return "pgcrond: " + command;
    }

    private static void line(StringBuilder banner, String label, String value) {
        banner.append(String.format("%-10s%s", label, value)).append('\n');
    }
}
