package com.pgcrond.jobs;

import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobFailedException;

/**
 * Runs the body of one job type.
 *
 * <p>A handler exists for every {@link com.pgcrond.core.JobType}. It receives the
 * job's context, performs the work and returns whatever the job printed or
 * returned. Whether that output is worth a report is decided afterwards by the
 * notification policy, not by the handler.</p>
 */
public interface JobHandler {

    /**
     * Execute the job body.
     *
     * @param context the job's entry, resolved DSN and variables
     * @return the captured output, empty when the job produced none
     * @throws JobFailedException if the job could not run; the message is reported as-is
     */
    String execute(JobContext context) throws JobFailedException;
}
