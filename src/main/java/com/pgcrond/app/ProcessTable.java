package com.pgcrond.app;

/**
 * View of the operating system's processes, as far as the daemon controller needs it.
 */
public interface ProcessTable {

    /**
     * Check whether a process with this PID exists and has not exited.
     */
    boolean isLive(long pid);

    /**
     * Ask a process to terminate.
     *
     * @return true if the request was delivered
     */
    boolean signal(long pid);

    /**
     * Get the PID of the current process.
     */
    long currentPid();
}
