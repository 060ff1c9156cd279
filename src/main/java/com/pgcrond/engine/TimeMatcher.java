package com.pgcrond.engine;

import java.time.ZonedDateTime;

/**
 * Decides whether a job's timespec selects a given minute.
 */
public interface TimeMatcher {

    /**
     * Check a five-field timespec against a minute.
     *
     * @param timespec minute, hour, day-of-month, month and day-of-week fields separated by spaces
     * @param minute the tick minute (seconds are zero)
     * @return true if the job is due at this minute
     * @throws InvalidTimespecException if the timespec cannot be parsed
     */
    boolean matches(String timespec, ZonedDateTime minute) throws InvalidTimespecException;
}
