package com.pgcrond.engine;

/**
 * Exception thrown when a job's timespec is not a valid five-field cron expression.
 *
 * <p>The scheduler treats such a job as malformed and skips it; it never stops the tick.</p>
 */
public class InvalidTimespecException extends Exception {

    public InvalidTimespecException(String timespec, Throwable cause) {
        super("Invalid timespec '" + timespec + "': " + cause.getMessage(), cause);
    }
}
