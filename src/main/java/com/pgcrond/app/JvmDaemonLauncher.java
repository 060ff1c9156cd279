package com.pgcrond.app;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Starts {@code pgcrond run} in a new JVM, detached from the caller.
 *
 * <p>The child runs in a session of its own through {@code setsid} when that tool is
 * installed. Its input comes from {@code /dev/null} and its output is appended to the
 * daemon log file (or discarded when there is none), so it keeps no handle on the
 * terminal that started it.</p>
 */
public class JvmDaemonLauncher implements DaemonLauncher {
    private static final Logger logger = Logger.getLogger(JvmDaemonLauncher.class.getName());

    /** Set on the daemon JVM so it logs to its file instead of the console. */
    public static final String DETACHED = "pgcrond.detached";

    private static final List<Path> SETSID_LOCATIONS = List.of(Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"));

    private final List<String> command;
    private final Path logFile;

    /**
     * @param javaExecutable the java binary to start
     * @param jvmArguments system properties for the daemon
     * @param classpath the daemon's classpath
     * @param logFile where daemon output is appended, or null to discard it
     */
    public JvmDaemonLauncher(String javaExecutable, List<String> jvmArguments, String classpath, Path logFile) {
        List<String> cmd = new ArrayList<>();
        findSetsid().ifPresent(setsid -> cmd.add(setsid.toString()));
        cmd.add(javaExecutable);
        cmd.addAll(jvmArguments);
        cmd.add("-D" + DETACHED + "=true");
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(Main.class.getName());
        cmd.add("run");
        this.command = List.copyOf(cmd);
        this.logFile = logFile;
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public Process launch() throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        builder.redirectErrorStream(true);
        if (logFile != null) {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }
        builder.directory(new File("/"));

        Process process = builder.start();
        logger.fine("Spawned " + String.join(" ", command) + " as process " + process.pid());
        return process;
    }

    private static Optional<Path> findSetsid() {
        return SETSID_LOCATIONS.stream().filter(Files::isExecutable).findFirst();
    }
}
