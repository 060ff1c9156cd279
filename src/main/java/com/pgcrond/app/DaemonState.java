package com.pgcrond.app;

/**
 * Enum representing the lifecycle states of the daemon.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>STOPPED → STARTING: {@code start} found no live daemon</li>
 *   <li>STARTING → RUNNING: the daemon recorded its PID and entered the tick loop</li>
 *   <li>STARTING → STOPPED: the daemon could not be started</li>
 *   <li>RUNNING → STOPPING: {@code stop} signalled the recorded PID</li>
 *   <li>STOPPING → STOPPED: the process is gone</li>
 *   <li>STOPPING → RUNNING: the process outlived every stop attempt</li>
 * </ul>
 *
 * <p>The state is never kept in memory between commands: it is derived from the PID
 * file and the process table each time.</p>
 */
public enum DaemonState {
    STOPPED("Stopped"),
    STARTING("Starting"),
    RUNNING("Running"),
    STOPPING("Stopping");

    private final String displayName;

    DaemonState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Validate if a transition to a new state is legal.
     */
    public boolean canTransitionTo(DaemonState next) {
        return switch (this) {
            case STOPPED -> next == STARTING;
            case STARTING -> next == RUNNING || next == STOPPED;
            case RUNNING -> next == STOPPING;
            case STOPPING -> next == STOPPED || next == RUNNING;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
