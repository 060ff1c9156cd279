package com.pgcrond.app;

import com.pgcrond.core.JobSnapshot;
import com.pgcrond.db.CredentialResolver;
import com.pgcrond.db.JdbcConnector;
import com.pgcrond.engine.ExecutionState;
import com.pgcrond.engine.JobExecution;
import com.pgcrond.engine.NotificationPolicy;
import com.pgcrond.engine.Reporter;
import com.pgcrond.exec.ProcessRunner;
import com.pgcrond.exec.SystemProcessRunner;
import com.pgcrond.jobs.JobHandlers;
import com.pgcrond.notify.SendmailNotifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the child JVM that runs one job.
 *
 * <p>Reads a {@link JobSnapshot} as JSON from standard input, runs it through the
 * execution pipeline and exits. The daemon ignores the exit status; failures reach
 * the job's recipient through the report path.</p>
 */
public final class JobRunner {
    private static final Logger logger = Logger.getLogger(JobRunner.class.getName());

    private JobRunner() {
    }

    public static void main(String[] args) {
        Main.initializeLogging();
        JobSnapshot snapshot;
        DaemonConfig config;
        try {
            String json = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            snapshot = JobSnapshot.fromJson(json);
            config = DaemonConfig.load();
        } catch (IOException | IllegalArgumentException e) {
            logger.log(Level.SEVERE, "Unable to start job", e);
            System.exit(1);
            return;
        }

        ExecutionState state = createExecution(config).run(snapshot);
        logger.fine("Job for line " + snapshot.getEntry().getLineNumber() + " ended " + state);
        System.exit(0);
    }

    /**
     * Wire the execution pipeline with the production collaborators.
     */
    static JobExecution createExecution(DaemonConfig config) {
        ProcessRunner processRunner = new SystemProcessRunner();
        return new JobExecution(
                new CredentialResolver(config.getPasswordStore()),
                JobHandlers.defaults(),
                new NotificationPolicy(),
                new Reporter(new SendmailNotifier(processRunner, config.getSendmail())),
                new JdbcConnector(),
                processRunner,
                config.isReportUnrunnable());
    }
}
