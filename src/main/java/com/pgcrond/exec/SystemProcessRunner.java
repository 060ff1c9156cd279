package com.pgcrond.exec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

// ProcessRunner backed by java.lang.ProcessBuilder
public class SystemProcessRunner implements ProcessRunner {
    private static final Logger logger = Logger.getLogger(SystemProcessRunner.class.getName());

    @Override
    public ProcessResult run(List<String> argv, Map<String, String> env, String stdin) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(argv);
        builder.redirectErrorStream(true);
        if (env != null) {
            builder.environment().putAll(env);
        }

        Process process = builder.start();
        feedInput(process, stdin);

        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        try {
            int exitCode = process.waitFor();
            logger.fine(argv.get(0) + " exited with " + exitCode);
            return new ProcessResult(exitCode, output);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + argv.get(0), e);
        }
    }

    // A child that exits without reading its input closes the pipe; that is not an error
    private static void feedInput(Process process, String stdin) {
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null && !stdin.isEmpty()) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Child closed its standard input early", e);
        }
    }
}
