package com.pgcrond.app;

import com.pgcrond.crontab.JobTableParser;
import com.pgcrond.engine.CronTimeMatcher;
import com.pgcrond.engine.InlineJobLauncher;
import com.pgcrond.engine.JobDispatcher;
import com.pgcrond.engine.JobLauncher;
import com.pgcrond.engine.ProcessJobLauncher;
import com.pgcrond.engine.Scheduler;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line entry point of pgcrond.
 *
 * <pre>
 * pgcrond start|stop|restart|status|version|help|run
 * </pre>
 *
 * <p>{@code run} is the daemon itself, in the foreground; {@code start} spawns it
 * detached and returns once it is running.</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static final Duration START_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration STOP_INTERVAL = Duration.ofSeconds(1);

    static final String USAGE = "Usage: pgcrond start|stop|restart|status|version|help|run";

    public static void main(String[] args) {
        initializeLogging();
        System.exit(execute(args, System.out, System.err));
    }

    /**
     * Run one CLI command.
     *
     * @return the process exit status
     */
    public static int execute(String[] args, PrintStream out, PrintStream err) {
        String command = args.length == 0 ? "" : args[0].toLowerCase(Locale.ROOT);
        switch (command) {
            case "version":
                out.println("pgcrond " + version());
                return 0;
            case "start":
            case "stop":
            case "restart":
            case "status":
            case "run":
                break;
            default:
                out.println(USAGE);
                return 0;
        }

        try {
            DaemonConfig config = DaemonConfig.load();
            DaemonController controller = createController(config);
            switch (command) {
                case "start":
                    out.println("pgcrond started (pid " + controller.start() + ")");
                    return 0;
                case "stop":
                    controller.stop();
                    out.println("pgcrond stopped");
                    return 0;
                case "restart":
                    out.println("pgcrond restarted (pid " + controller.restart() + ")");
                    return 0;
                case "status":
                    OptionalLong pid = controller.status();
                    if (pid.isPresent()) {
                        out.println(pid.getAsLong());
                        return 0;
                    }
                    out.println("Stopped");
                    return 1;
                default:
                    runDaemon(config, controller);
                    return 0;
            }
        } catch (DaemonException e) {
            err.println("pgcrond: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            err.println("pgcrond: configuration error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Become the daemon: claim the PID file and run the tick loop until terminated.
     */
    static void runDaemon(DaemonConfig config, DaemonController controller) throws DaemonException {
        if (Boolean.getBoolean(JvmDaemonLauncher.DETACHED)) {
            initializeFileLogging(config.getLogFile());
        }
        logger.info("=== pgcrond " + version() + " starting ===");

        long pid = controller.claim();
        JobDispatcher dispatcher = new JobDispatcher(initializeLauncher(config));
        Scheduler scheduler = new Scheduler(config.getJobTable(), new JobTableParser(), new CronTimeMatcher(),
                dispatcher, Clock.systemDefaultZone(), config.getTickInterval());

        addShutdownHook(scheduler, dispatcher, controller, pid, config.isKillJobsOnStop());
        scheduler.start();
        controller.release(pid);
    }

    static DaemonController createController(DaemonConfig config) {
        DaemonLauncher launcher = new JvmDaemonLauncher(ProcessJobLauncher.currentJavaExecutable(),
                config.toJvmArguments(), System.getProperty("java.class.path"), config.getLogFile());
        return new DaemonController(new PidFile(config.getPidFile()), new ProcessHandleTable(), launcher,
                config.getStopAttempts(), STOP_INTERVAL, START_TIMEOUT);
    }

    /**
     * Create the launcher for the configured isolation mode.
     */
    static JobLauncher initializeLauncher(DaemonConfig config) {
        switch (config.getIsolation()) {
            case THREAD:
                logger.info("Running jobs in-process with " + config.getWorkers() + " workers");
                return new InlineJobLauncher(config.getWorkers(), JobRunner.createExecution(config));
            case PROCESS:
            default:
                logger.info("Running each job in its own JVM");
                return new ProcessJobLauncher(ProcessJobLauncher.currentJavaExecutable(), config.toJvmArguments(),
                        System.getProperty("java.class.path"), JobRunner.class.getName(), config.getLogFile(),
                        config.getJobTimeout());
        }
    }

    /**
     * Add a shutdown hook for graceful shutdown on SIGTERM.
     */
    private static void addShutdownHook(Scheduler scheduler, JobDispatcher dispatcher, DaemonController controller,
                                        long pid, boolean killJobs) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            scheduler.shutdown();
            dispatcher.shutdown(killJobs);
            controller.release(pid);
            logger.info("=== pgcrond stopped ===");
        }, "Shutdown-Hook"));
    }

    /**
     * Load the bundled logging configuration unless one was given on the command line.
     */
    static void initializeLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("pgcrond: unable to load logging configuration: " + e.getMessage());
        }
    }

    /**
     * Send all logging to the daemon log file instead of the console.
     */
    private static void initializeFileLogging(Path logFile) {
        if (logFile == null) {
            return;
        }
        Logger root = Logger.getLogger("");
        try {
            FileHandler handler = new FileHandler(logFile.toString(), true);
            handler.setFormatter(new SimpleFormatter());
            for (Handler existing : root.getHandlers()) {
                root.removeHandler(existing);
            }
            root.addHandler(handler);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Unable to log to " + logFile + ", keeping console logging", e);
        }
    }

    static String version() {
        String version = Main.class.getPackage().getImplementationVersion();
        return version != null ? version : "development";
    }
}
