package com.pgcrond.engine;

import com.pgcrond.core.JobEntry;
import com.pgcrond.crontab.JobTable;
import com.pgcrond.crontab.JobTableParser;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The minute tick loop of the daemon.
 *
 * <p>The scheduler polls the clock in small increments (one second by default). Each
 * time the wall-clock minute changes it runs one pass: it rereads the job table, asks
 * the time matcher about every entry and dispatches the due ones in file order.</p>
 *
 * <p><b>Key Guarantees:</b></p>
 * <ul>
 *   <li>A job fires at most once per matching minute, however often the loop polls</li>
 *   <li>A job fires even when the previous pass finished within the same second</li>
 *   <li>A pass that overruns its minute is not preempted; the next pass starts right after</li>
 *   <li>The minute the daemon starts in is processed</li>
 *   <li>Edits to the job table take effect on the next minute, without a restart</li>
 * </ul>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li>Missing or unreadable job table: the pass is skipped</li>
 *   <li>Invalid timespec: that entry is skipped</li>
 *   <li>Anything unexpected: logged, and the loop carries on with the next poll</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Scheduler scheduler = new Scheduler(crontab, new JobTableParser(), new CronTimeMatcher(),
 *         dispatcher, Clock.systemDefaultZone(), Duration.ofSeconds(1));
 * scheduler.start(); // blocks until shutdown()
 * }</pre>
 *
 * @see JobDispatcher
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final Path jobTable;
    private final JobTableParser parser;
    private final TimeMatcher timeMatcher;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final Duration tickInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ZonedDateTime lastMinute;
    private volatile Thread loopThread;

    /**
     * @param jobTable path of the job table, reread every minute
     * @param parser job table parser
     * @param timeMatcher decides which timespecs are due
     * @param dispatcher starts due jobs
     * @param clock source of wall-clock time
     * @param tickInterval how long the loop sleeps between polls
     */
    public Scheduler(Path jobTable, JobTableParser parser, TimeMatcher timeMatcher, JobDispatcher dispatcher,
                     Clock clock, Duration tickInterval) {
        this.jobTable = jobTable;
        this.parser = parser;
        this.timeMatcher = timeMatcher;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    /**
     * Run the tick loop until {@link #shutdown()} is called.
     *
     * <p>BLOCKING METHOD: the daemon calls it from its main thread.</p>
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }
        loopThread = Thread.currentThread();
        logger.info("Scheduler started on " + jobTable + ", polling every " + tickInterval.toMillis() + "ms");

        while (running.get()) {
            try {
                pollOnce();
                Thread.sleep(tickInterval.toMillis());
            } catch (InterruptedException e) {
                logger.info("Scheduler interrupted, shutting down");
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error in scheduling loop", e);
            }
        }

        running.set(false);
        logger.info("Scheduler loop exited");
    }

    /**
     * Check the clock once and run a pass if a new minute has begun.
     *
     * @return true if a pass was run
     */
    public boolean pollOnce() {
        ZonedDateTime minute = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        if (minute.equals(lastMinute)) {
            return false;
        }
        lastMinute = minute;
        runPass(minute);
        return true;
    }

    /**
     * Run one full parse-and-dispatch pass for a minute.
     *
     * @param minute the tick minute
     * @return the number of jobs dispatched
     */
    public int runPass(ZonedDateTime minute) {
        JobTable table;
        try {
            table = parser.parse(jobTable);
        } catch (IOException e) {
            logger.warning("Cannot read job table " + jobTable + ", skipping " + minute + ": " + e.getMessage());
            return 0;
        }

        int dispatched = 0;
        for (JobEntry entry : table.getEntries()) {
            boolean due;
            try {
                due = timeMatcher.matches(entry.getTimespec(), minute);
            } catch (InvalidTimespecException e) {
                logger.warning("Skipping line " + entry.getLineNumber() + ": " + e.getMessage());
                continue;
            }
            if (due && dispatcher.dispatch(table.getVariables(), entry, minute)) {
                dispatched++;
            }
        }
        logger.fine("Pass for " + minute + ": " + table.getEntries().size() + " entries, " + dispatched + " dispatched");
        return dispatched;
    }

    /**
     * Stop the tick loop. A pass in progress finishes first.
     */
    public void shutdown() {
        if (running.getAndSet(false)) {
            logger.info("Initiating scheduler shutdown...");
            Thread thread = loopThread;
            if (thread != null && thread != Thread.currentThread()) {
                thread.interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the last minute a pass was run for, or null before the first poll.
     */
    public ZonedDateTime getLastMinute() {
        return lastMinute;
    }
}
