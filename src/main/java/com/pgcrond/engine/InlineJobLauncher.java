package com.pgcrond.engine;

import com.pgcrond.core.JobSnapshot;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launcher that runs jobs on a fixed pool of worker threads inside the daemon.
 *
 * <p>Each job still gets its own context and variable set, but shares the daemon's
 * process: a job that changes the working directory or crashes the JVM is not
 * contained. Use it where forking a JVM per job is too expensive, and in tests.</p>
 */
public class InlineJobLauncher implements JobLauncher {
    private static final Logger logger = Logger.getLogger(InlineJobLauncher.class.getName());

    private final ExecutorService executorService;
    private final JobExecution execution;

    /**
     * @param workerCount number of worker threads
     * @param execution the pipeline each job runs through
     */
    public InlineJobLauncher(int workerCount, JobExecution execution) {
        this.executorService = Executors.newFixedThreadPool(workerCount);
        this.execution = execution;
        logger.info("Inline launcher initialized with " + workerCount + " workers");
    }

    @Override
    public void launch(JobSnapshot snapshot) throws IOException {
        try {
            executorService.submit(() -> {
                try {
                    execution.run(snapshot);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Job crashed: " + snapshot, e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IOException("Launcher is shut down", e);
        }
    }

    @Override
    public void shutdown(boolean terminateRunning) {
        if (terminateRunning) {
            executorService.shutdownNow();
            return;
        }
        executorService.shutdown();
    }

    /**
     * Wait for submitted jobs to finish after {@link #shutdown(boolean)}.
     *
     * @return true if all jobs finished within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executorService.awaitTermination(timeout, unit);
    }
}
