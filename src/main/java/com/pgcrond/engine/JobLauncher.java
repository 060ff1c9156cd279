package com.pgcrond.engine;

import com.pgcrond.core.JobSnapshot;

import java.io.IOException;

/**
 * Starts the isolated execution unit of a due job.
 *
 * <p>A launcher never waits for the job: {@link #launch(JobSnapshot)} returns as soon
 * as the job is on its way, so the tick loop keeps its one-minute rhythm however long
 * jobs run.</p>
 */
public interface JobLauncher {

    /**
     * Start a job.
     *
     * @param snapshot the job's variables, entry and tick minute
     * @throws IOException if the execution unit could not be started
     */
    void launch(JobSnapshot snapshot) throws IOException;

    /**
     * Stop accepting jobs.
     *
     * @param terminateRunning whether jobs still running are terminated as well
     */
    void shutdown(boolean terminateRunning);
}
