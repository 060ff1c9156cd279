package com.pgcrond.app;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Implements the {@code start}, {@code stop}, {@code restart} and {@code status}
 * commands on top of the PID file and the process table.
 *
 * <p>No daemon state is kept between commands. Every command re-derives it: a PID
 * file naming a live process means {@link DaemonState#RUNNING}, anything else means
 * {@link DaemonState#STOPPED}. A PID file naming a process that is gone is stale and
 * is deleted by whichever check notices it.</p>
 *
 * <p><b>Command Semantics:</b></p>
 * <ul>
 *   <li>{@code start}: refused when a daemon is running; otherwise spawns one and waits
 *       until it has recorded a live PID</li>
 *   <li>{@code stop}: "not started" when no daemon is running; otherwise signals the
 *       daemon once per interval until it is gone, failing with "timeout" after the
 *       configured number of attempts</li>
 *   <li>{@code restart}: {@code stop} then {@code start}; a failed stop ends it</li>
 *   <li>{@code run}: the daemon's own side, claiming and releasing the PID file</li>
 * </ul>
 */
public class DaemonController {
    private static final Logger logger = Logger.getLogger(DaemonController.class.getName());

    private static final Duration START_POLL = Duration.ofMillis(100);

    private final PidFile pidFile;
    private final ProcessTable processes;
    private final DaemonLauncher launcher;
    private final int stopAttempts;
    private final Duration stopInterval;
    private final Duration startTimeout;

    /**
     * @param pidFile the daemon's PID file
     * @param processes the process table used for liveness checks and signals
     * @param launcher spawns the detached daemon for {@code start}
     * @param stopAttempts how many signals {@code stop} sends before giving up
     * @param stopInterval the pause after each signal
     * @param startTimeout how long {@code start} waits for the daemon to record its PID
     */
    public DaemonController(PidFile pidFile, ProcessTable processes, DaemonLauncher launcher,
                            int stopAttempts, Duration stopInterval, Duration startTimeout) {
        if (stopAttempts < 1) {
            throw new IllegalArgumentException("stopAttempts must be at least 1");
        }
        this.pidFile = pidFile;
        this.processes = processes;
        this.launcher = launcher;
        this.stopAttempts = stopAttempts;
        this.stopInterval = stopInterval;
        this.startTimeout = startTimeout;
    }

    /**
     * Get the PID of the running daemon.
     *
     * @return the live PID, or empty when stopped
     * @throws DaemonException if the PID file cannot be read or a stale one cannot be removed
     */
    public OptionalLong status() throws DaemonException {
        OptionalLong recorded;
        try {
            recorded = pidFile.read();
        } catch (IOException e) {
            throw new DaemonException("Unable to read PID file " + pidFile + ": " + e.getMessage(), e);
        }
        if (recorded.isPresent() && processes.isLive(recorded.getAsLong())) {
            return recorded;
        }
        if (pidFile.exists()) {
            logger.info("Removing stale PID file " + pidFile);
            try {
                pidFile.delete();
            } catch (IOException e) {
                throw new DaemonException("Unable to remove stale PID file " + pidFile + ": " + e.getMessage(), e);
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Get the daemon state as seen from the PID file and process table.
     */
    public DaemonState getState() throws DaemonException {
        return status().isPresent() ? DaemonState.RUNNING : DaemonState.STOPPED;
    }

    /**
     * Spawn a detached daemon and wait until it is running.
     *
     * @return the daemon's PID
     * @throws DaemonException if a daemon is already running or the new one does not come up
     */
    public long start() throws DaemonException {
        OptionalLong running = status();
        if (running.isPresent()) {
            throw new DaemonException("already running (pid " + running.getAsLong() + ")");
        }
        DaemonState state = advance(DaemonState.STOPPED, DaemonState.STARTING);

        Process process;
        try {
            process = launcher.launch();
        } catch (IOException e) {
            advance(state, DaemonState.STOPPED);
            throw new DaemonException("Unable to spawn daemon: " + e.getMessage(), e);
        }

        Instant deadline = Instant.now().plus(startTimeout);
        while (true) {
            OptionalLong pid = status();
            if (pid.isPresent()) {
                advance(state, DaemonState.RUNNING);
                logger.info("Daemon started with pid " + pid.getAsLong());
                return pid.getAsLong();
            }
            if (!process.isAlive()) {
                advance(state, DaemonState.STOPPED);
                throw new DaemonException("daemon exited during startup with status " + process.exitValue());
            }
            if (Instant.now().isAfter(deadline)) {
                advance(state, DaemonState.STOPPED);
                throw new DaemonException("daemon did not record its pid within " + startTimeout.toSeconds() + "s");
            }
            pause(START_POLL);
        }
    }

    /**
     * Signal the running daemon until it exits.
     *
     * @throws DaemonException "not started" when no daemon is running, "timeout" when it
     *                         outlives every attempt
     */
    public void stop() throws DaemonException {
        OptionalLong running = status();
        if (running.isEmpty()) {
            throw new DaemonException("not started");
        }
        long pid = running.getAsLong();
        DaemonState state = advance(DaemonState.RUNNING, DaemonState.STOPPING);

        for (int attempt = 1; attempt <= stopAttempts; attempt++) {
            if (!processes.signal(pid)) {
                logger.fine("Signal to " + pid + " not delivered on attempt " + attempt);
            }
            pause(stopInterval);
            if (!processes.isLive(pid)) {
                advance(state, DaemonState.STOPPED);
                // the daemon's own shutdown hook normally removes it
                status();
                logger.info("Daemon " + pid + " stopped after " + attempt + " attempt(s)");
                return;
            }
        }
        advance(state, DaemonState.RUNNING);
        throw new DaemonException("timeout");
    }

    /**
     * Stop the daemon, then start a new one.
     *
     * @return the new daemon's PID
     */
    public long restart() throws DaemonException {
        stop();
        return start();
    }

    /**
     * Record the current process as the daemon.
     *
     * @return the recorded PID
     * @throws DaemonException if another daemon is running or the PID file cannot be written
     */
    public long claim() throws DaemonException {
        OptionalLong running = status();
        long self = processes.currentPid();
        if (running.isPresent() && running.getAsLong() != self) {
            throw new DaemonException("already running (pid " + running.getAsLong() + ")");
        }
        try {
            pidFile.write(self);
        } catch (IOException e) {
            throw new DaemonException("Unable to write PID file " + pidFile + ": " + e.getMessage(), e);
        }
        logger.info("Recorded pid " + self + " in " + pidFile);
        return self;
    }

    /**
     * Remove the PID file if it still names the given process.
     */
    public void release(long pid) {
        try {
            OptionalLong recorded = pidFile.read();
            if (recorded.isPresent() && recorded.getAsLong() == pid) {
                pidFile.delete();
                logger.info("Removed PID file " + pidFile);
            }
        } catch (IOException e) {
            logger.warning("Unable to remove PID file " + pidFile + ": " + e.getMessage());
        }
    }

    private static DaemonState advance(DaemonState from, DaemonState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to);
        }
        logger.fine("Daemon " + from + " -> " + to);
        return to;
    }

    private static void pause(Duration duration) throws DaemonException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DaemonException("interrupted", e);
        }
    }
}
