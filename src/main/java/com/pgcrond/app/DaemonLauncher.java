package com.pgcrond.app;

import java.io.IOException;

/**
 * Starts a detached daemon process.
 */
public interface DaemonLauncher {

    /**
     * Spawn the daemon. The returned process is the daemon itself (or the session
     * wrapper that becomes it); the caller does not wait for it.
     *
     * @throws IOException if the process cannot be started
     */
    Process launch() throws IOException;
}
