package com.pgcrond.core;

import java.util.Locale;

/**
 * Enum representing the kinds of job body a job table line can declare.
 *
 * <p>The type field of a job table line is matched case-insensitively against
 * each constant's keyword:</p>
 * <ul>
 *   <li>DIRECT ({@code direct}): the command is one SQL statement run in a transaction</li>
 *   <li>PSQL ({@code psql}): the command names a session file fed to the psql client</li>
 *   <li>EMBEDDED_SCRIPT ({@code perl}): the command names a script whose {@code run}
 *       entry point is invoked with a live connection</li>
 *   <li>SHELL ({@code sh}): the command is a shell command line</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see com.pgcrond.jobs.JobHandlers
 */
public enum JobType {
    DIRECT("direct"),
    PSQL("psql"),
    EMBEDDED_SCRIPT("perl"),
    SHELL("sh");

    private final String keyword;

    JobType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Get the keyword used for this type in the job table.
     *
     * @return the lower-case keyword (e.g., "psql", "sh")
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Look up a job type by its job table keyword, ignoring case.
     *
     * @param keyword the type field of a job table line
     * @return the matching type, or null if the keyword is not a known type
     */
    public static JobType fromKeyword(String keyword) {
        if (keyword == null) {
            return null;
        }
        String normalized = keyword.toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.keyword.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
