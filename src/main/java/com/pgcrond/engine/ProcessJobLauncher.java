package com.pgcrond.engine;

import com.pgcrond.core.JobSnapshot;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Launcher that runs every job in a child JVM of its own.
 *
 * <p>The child is started on the daemon's classpath with the job runner's main class
 * and receives the job snapshot as JSON on its standard input. Once the snapshot is
 * written the input is closed, so the job and everything it starts read an empty
 * input. The child's output goes to the daemon log file (or is discarded).</p>
 *
 * <p><b>Process Lifecycle:</b></p>
 * <ul>
 *   <li>The launcher does not wait; exits are observed through {@link Process#onExit()}</li>
 *   <li>With a job timeout, a child still alive after the deadline is destroyed</li>
 *   <li>{@link #shutdown(boolean)} with {@code true} destroys all children still running</li>
 * </ul>
 */
public class ProcessJobLauncher implements JobLauncher {
    private static final Logger logger = Logger.getLogger(ProcessJobLauncher.class.getName());

    private final List<String> command;
    private final Path logFile;
    private final Duration timeout;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown;

    /**
     * @param javaExecutable the java binary to start
     * @param jvmArguments extra JVM arguments (system properties)
     * @param classpath the classpath of the child
     * @param mainClass the job runner's main class
     * @param logFile where child output is appended, or null to discard it
     * @param timeout per-job deadline, or null/zero for none
     */
    public ProcessJobLauncher(String javaExecutable, List<String> jvmArguments, String classpath,
                              String mainClass, Path logFile, Duration timeout) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable);
        cmd.addAll(jvmArguments);
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(mainClass);
        this.command = List.copyOf(cmd);
        this.logFile = logFile;
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public void launch(JobSnapshot snapshot) throws IOException {
        if (shutdown) {
            throw new IOException("Launcher is shut down");
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        if (logFile != null) {
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }

        Process process = builder.start();
        running.add(process);
        try (OutputStream in = process.getOutputStream()) {
            in.write(snapshot.toJson().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroyForcibly();
            running.remove(process);
            throw new IOException("Unable to hand job to child process " + process.pid(), e);
        }

        int line = snapshot.getEntry().getLineNumber();
        logger.info("Line " + line + " started as process " + process.pid());
        process.onExit().thenAccept(done -> {
            running.remove(done);
            logger.fine("Process " + done.pid() + " for line " + line + " exited with " + done.exitValue());
        });
        if (timeout != null) {
            process.onExit()
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        logger.warning("Process " + process.pid() + " for line " + line
                                + " exceeded " + timeout.toSeconds() + "s, destroying it");
                        process.descendants().forEach(ProcessHandle::destroyForcibly);
                        process.destroyForcibly();
                        return process;
                    });
        }
    }

    @Override
    public void shutdown(boolean terminateRunning) {
        shutdown = true;
        if (!terminateRunning) {
            if (!running.isEmpty()) {
                logger.info(running.size() + " job process(es) left running");
            }
            return;
        }
        for (Process process : running) {
            logger.info("Terminating job process " + process.pid());
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }
    }

    /**
     * Get the number of child processes still running.
     */
    public int getRunningCount() {
        return running.size();
    }

    /**
     * Locate the java binary of the running JVM.
     */
    public static String currentJavaExecutable() {
        return ProcessHandle.current().info().command()
                .orElse(System.getProperty("java.home") + File.separator + "bin" + File.separator + "java");
    }
}
