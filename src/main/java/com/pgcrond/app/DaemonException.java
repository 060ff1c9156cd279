package com.pgcrond.app;

/**
 * Exception thrown when a lifecycle command cannot do what was asked.
 *
 * <p>The CLI prints the message and exits with a non-zero status.</p>
 */
public class DaemonException extends Exception {

    public DaemonException(String message) {
        super(message);
    }

    public DaemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
