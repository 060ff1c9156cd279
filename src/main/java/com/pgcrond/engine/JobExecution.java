package com.pgcrond.engine;

import com.pgcrond.core.CredentialException;
import com.pgcrond.core.JobContext;
import com.pgcrond.core.JobEntry;
import com.pgcrond.core.JobFailedException;
import com.pgcrond.core.JobSnapshot;
import com.pgcrond.core.JobType;
import com.pgcrond.core.ResolvedDsn;
import com.pgcrond.core.VariableSet;
import com.pgcrond.db.CredentialResolver;
import com.pgcrond.db.DbConnector;
import com.pgcrond.exec.ProcessRunner;
import com.pgcrond.jobs.JobHandlers;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the complete pipeline of one due job inside its isolated execution unit.
 *
 * <p><b>Execution Flow:</b></p>
 * <ol>
 *   <li>Resolve the DSN; an incomplete one ends the job silently (SKIPPED)</li>
 *   <li>Look up the password; an unreadable store is reported</li>
 *   <li>Run the handler for the job type with a context of its own</li>
 *   <li>A handler failure is reported with the handler's message</li>
 *   <li>Otherwise the notification policy decides whether the output is reported</li>
 * </ol>
 *
 * <p>Every path ends in a terminal {@link ExecutionState}; reporting is the last thing
 * a job does, so "already notified" is simply {@code DONE} after {@code REPORTING}.</p>
 *
 * <p><b>Error Handling Strategy:</b></p>
 * <ul>
 *   <li>CredentialException → report, DONE</li>
 *   <li>JobFailedException → report, DONE</li>
 *   <li>Any other exception from a handler → logged and reported as an internal error</li>
 * </ul>
 *
 * <p>There is no retry: a failed job next runs at its next scheduled minute.</p>
 *
 * @see JobLauncher
 * @see NotificationPolicy
 */
public class JobExecution {
    private static final Logger logger = Logger.getLogger(JobExecution.class.getName());

    private final CredentialResolver credentialResolver;
    private final JobHandlers handlers;
    private final NotificationPolicy policy;
    private final Reporter reporter;
    private final DbConnector connector;
    private final ProcessRunner processRunner;
    private final boolean reportUnrunnable;

    /**
     * Create an execution pipeline.
     *
     * @param credentialResolver resolves DSN and password
     * @param handlers the handler for each job type
     * @param policy decides which output is reported
     * @param reporter sends reports
     * @param connector opens database connections for handlers
     * @param processRunner runs subprocesses for handlers
     * @param reportUnrunnable whether a job without database or user is reported instead of skipped silently
     */
    public JobExecution(CredentialResolver credentialResolver, JobHandlers handlers, NotificationPolicy policy,
                        Reporter reporter, DbConnector connector, ProcessRunner processRunner,
                        boolean reportUnrunnable) {
        this.credentialResolver = credentialResolver;
        this.handlers = handlers;
        this.policy = policy;
        this.reporter = reporter;
        this.connector = connector;
        this.processRunner = processRunner;
        this.reportUnrunnable = reportUnrunnable;
    }

    /**
     * Execute one job and return the state it finished in.
     *
     * @param snapshot the job's variables, entry and tick minute
     * @return DONE or SKIPPED
     */
    public ExecutionState run(JobSnapshot snapshot) {
        Pipeline pipeline = new Pipeline(snapshot.getEntry());
        JobEntry entry = snapshot.getEntry();
        VariableSet variables = snapshot.getVariables();
        logger.info("Running line " + entry.getLineNumber() + " (" + entry.getType() + ") scheduled for "
                + snapshot.getScheduledFor());

        JobType type = entry.getJobType();
        if (type == null) {
            logger.warning("Line " + entry.getLineNumber() + " has unknown job type '" + entry.getType() + "'");
            return pipeline.moveTo(ExecutionState.SKIPPED);
        }

        // === RESOLVING ===
        Optional<ResolvedDsn> unresolved = credentialResolver.resolveDsn(variables, entry);
        if (unresolved.isEmpty()) {
            if (reportUnrunnable) {
                pipeline.moveTo(ExecutionState.REPORTING);
                reporter.report(variables, entry, null, "Job skipped: database and user must both be set");
                return pipeline.moveTo(ExecutionState.DONE);
            }
            return pipeline.moveTo(ExecutionState.SKIPPED);
        }

        ResolvedDsn dsn;
        try {
            dsn = credentialResolver.resolvePassword(unresolved.get());
        } catch (CredentialException e) {
            logger.log(Level.WARNING, "Credential lookup failed for line " + entry.getLineNumber(), e);
            return report(pipeline, variables, entry, unresolved.get(), e.getMessage());
        }

        // === DISPATCHING ===
        pipeline.moveTo(ExecutionState.DISPATCHING);
        VariableSet jobVariables = variables.withResolvedDsn(dsn);
        JobContext context = new JobContext(entry, dsn, jobVariables, connector, processRunner,
                credentialResolver.getConfiguredStore());

        String output;
        try {
            output = handlers.forType(type).execute(context);
        } catch (JobFailedException e) {
            logger.warning("Line " + entry.getLineNumber() + " failed: " + e.getMessage());
            return report(pipeline, jobVariables, entry, dsn, e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error running line " + entry.getLineNumber(), e);
            return report(pipeline, jobVariables, entry, dsn, "Internal error running job: " + e);
        }

        // === EVALUATING ===
        pipeline.moveTo(ExecutionState.EVALUATING);
        Optional<String> message = policy.evaluate(type, output);
        if (message.isEmpty()) {
            return pipeline.moveTo(ExecutionState.DONE);
        }
        return report(pipeline, jobVariables, entry, dsn, message.get());
    }

    private ExecutionState report(Pipeline pipeline, VariableSet variables, JobEntry entry,
                                  ResolvedDsn dsn, String message) {
        pipeline.moveTo(ExecutionState.REPORTING);
        reporter.report(variables, entry, dsn, message);
        return pipeline.moveTo(ExecutionState.DONE);
    }

    // Tracks one job's state and rejects illegal transitions
    private static final class Pipeline {
        private final JobEntry entry;
        private ExecutionState state = ExecutionState.RESOLVING;

        Pipeline(JobEntry entry) {
            this.entry = entry;
        }

        ExecutionState moveTo(ExecutionState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            state = next;
            if (next.isTerminal()) {
                logger.info("Line " + entry.getLineNumber() + " finished: " + next);
            }
            return next;
        }
    }
}
