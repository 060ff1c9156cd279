package com.pgcrond.core;

/**
 * Exception thrown by a job handler when the job body could not complete.
 *
 * <p>The message is the text that ends up in the failure report, so handlers
 * build it with the job-specific context the recipient needs (for example
 * {@code "Error performing SQL operation: " + driverMessage}). Throwing it ends
 * the job's pipeline: the execution reports the message once and stops.</p>
 *
 * @see com.pgcrond.jobs.JobHandler#execute(JobContext)
 */
public class JobFailedException extends Exception {

    /**
     * Create a new JobFailedException.
     *
     * @param message the report text
     */
    public JobFailedException(String message) {
        super(message);
    }

    /**
     * Create a new JobFailedException with a cause.
     *
     * @param message the report text
     * @param cause the underlying cause
     */
    public JobFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
