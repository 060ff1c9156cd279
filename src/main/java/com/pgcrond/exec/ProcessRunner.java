package com.pgcrond.exec;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Runs a subprocess to completion and captures what it prints.
 */
public interface ProcessRunner {

    /**
     * Run a command and wait for it to exit.
     *
     * <p>Standard error is merged into standard output. The child's environment is
     * the daemon's environment with {@code env} merged over it.</p>
     *
     * @param argv the program and its arguments
     * @param env variables to add to the inherited environment
     * @param stdin text written to the child's standard input, or null for an empty input
     * @return the exit code and the combined output
     * @throws IOException if the program cannot be started or its output cannot be read
     */
    ProcessResult run(List<String> argv, Map<String, String> env, String stdin) throws IOException;
}
