package com.pgcrond.engine;

import com.pgcrond.core.JobType;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a job's captured output is worth a report.
 *
 * <p><b>Rules by job type:</b></p>
 * <ul>
 *   <li>direct: output is never reported; statement failures are reported
 *       by the execution before this policy is consulted</li>
 *   <li>sh and perl: any output at all is reported, even a bare newline</li>
 *   <li>psql: output is reported only when it contains {@code WARNING} or
 *       {@code ERROR}, or a timing line of ten seconds or more
 *       ({@code Time: 12345.678 ms})</li>
 * </ul>
 *
 * <p>The psql rule keeps routine, successful jobs that print {@code \timing}
 * lines from sending mail every run.</p>
 */
public class NotificationPolicy {
    // Five or more integer digits of milliseconds is at least ten seconds
    private static final Pattern SLOW_TIMING = Pattern.compile("Time: \\d{5,}\\.\\d+ ms");

    /**
     * Evaluate a job's output.
     *
     * @param type the job type
     * @param output the captured output, may be null
     * @return the text to report, or empty if nothing should be sent
     */
    public Optional<String> evaluate(JobType type, String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        boolean notable = switch (type) {
            case DIRECT -> false;
            case SHELL, EMBEDDED_SCRIPT -> true;
            case PSQL -> isNotablePsqlOutput(output);
        };
        return notable ? Optional.of(output) : Optional.empty();
    }

    public static boolean isNotablePsqlOutput(String output) {
        return output.contains("WARNING")
                || output.contains("ERROR")
                || SLOW_TIMING.matcher(output).find();
    }
}
