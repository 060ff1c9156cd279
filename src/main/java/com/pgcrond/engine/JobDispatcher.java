package com.pgcrond.engine;

import com.pgcrond.core.JobEntry;
import com.pgcrond.core.JobSnapshot;
import com.pgcrond.core.VariableSet;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands due jobs to their isolated execution units.
 *
 * <p>Jobs are dispatched in the order the scheduler passes them in, which is job table
 * order. The dispatcher does not wait for jobs and does not know how they end; a job
 * that cannot even be started is logged and abandoned until its next scheduled
 * minute.</p>
 */
public class JobDispatcher {
    private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

    private final JobLauncher launcher;

    public JobDispatcher(JobLauncher launcher) {
        this.launcher = launcher;
    }

    /**
     * Dispatch one due job.
     *
     * @param variables the tick's variables; the job receives its own copy
     * @param entry the due entry
     * @param minute the tick minute
     * @return true if the job was launched
     */
    public boolean dispatch(VariableSet variables, JobEntry entry, ZonedDateTime minute) {
        if (entry.getJobType() == null) {
            logger.warning("Skipping line " + entry.getLineNumber() + ": unknown job type '" + entry.getType() + "'");
            return false;
        }
        try {
            launcher.launch(new JobSnapshot(variables, entry, minute));
            return true;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to launch line " + entry.getLineNumber(), e);
            return false;
        }
    }

    public void shutdown(boolean terminateRunning) {
        launcher.shutdown(terminateRunning);
    }
}
