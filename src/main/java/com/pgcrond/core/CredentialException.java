package com.pgcrond.core;

/**
 * Exception thrown when the password store cannot be located or read.
 *
 * <p>Unlike an incomplete DSN, which is skipped silently, a credential error is
 * always reported to the job's mail recipient.</p>
 *
 * @see com.pgcrond.db.CredentialResolver
 */
public class CredentialException extends Exception {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
