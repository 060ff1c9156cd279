package com.pgcrond.app;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Daemon configuration.
 *
 * <p>Settings are read from {@code /etc/pgcrond/pgcrond.properties} (another file can
 * be named with {@code -Dpgcrond.config=...}; a missing file means all defaults), then
 * any {@code pgcrond.*} system property overrides the file.</p>
 *
 * <p><b>Keys:</b></p>
 * <ul>
 *   <li>{@code pgcrond.crontab} job table, default {@code /etc/pgcrontab}</li>
 *   <li>{@code pgcrond.pidfile} PID file, default {@code /var/run/pgcrond.pid}</li>
 *   <li>{@code pgcrond.logfile} daemon log, default {@code /var/log/pgcrond.log}</li>
 *   <li>{@code pgcrond.pgpass} password store, default {@code ~/.pgpass}</li>
 *   <li>{@code pgcrond.sendmail} mail transport, default {@code /usr/sbin/sendmail}</li>
 *   <li>{@code pgcrond.isolation} {@code process} (child JVM per job) or {@code thread}</li>
 *   <li>{@code pgcrond.workers} worker threads for {@code thread} isolation, default 4</li>
 *   <li>{@code pgcrond.tick.millis} polling interval, default 1000</li>
 *   <li>{@code pgcrond.stop.attempts} signals sent by {@code stop} before giving up, default 25</li>
 *   <li>{@code pgcrond.stop.kill-jobs} terminate running jobs when the daemon stops, default false</li>
 *   <li>{@code pgcrond.job.timeout.seconds} per-job deadline, default 0 (none)</li>
 *   <li>{@code pgcrond.report.unrunnable} report jobs lacking database or user, default false</li>
 * </ul>
 */
public class DaemonConfig {
    private static final Logger logger = Logger.getLogger(DaemonConfig.class.getName());

    public static final String PREFIX = "pgcrond.";
    public static final String CONFIG_FILE = "pgcrond.config";
    public static final String DEFAULT_CONFIG_FILE = "/etc/pgcrond/pgcrond.properties";

    public static final String CRONTAB = "pgcrond.crontab";
    public static final String PIDFILE = "pgcrond.pidfile";
    public static final String LOGFILE = "pgcrond.logfile";
    public static final String PGPASS = "pgcrond.pgpass";
    public static final String SENDMAIL = "pgcrond.sendmail";
    public static final String ISOLATION = "pgcrond.isolation";
    public static final String WORKERS = "pgcrond.workers";
    public static final String TICK_MILLIS = "pgcrond.tick.millis";
    public static final String STOP_ATTEMPTS = "pgcrond.stop.attempts";
    public static final String STOP_KILL_JOBS = "pgcrond.stop.kill-jobs";
    public static final String JOB_TIMEOUT_SECONDS = "pgcrond.job.timeout.seconds";
    public static final String REPORT_UNRUNNABLE = "pgcrond.report.unrunnable";

    /**
     * How each job is isolated from the daemon.
     */
    public enum Isolation {
        PROCESS,
        THREAD
    }

    private final Properties properties;

    public DaemonConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     * Load the configuration file and apply system property overrides.
     *
     * @throws IOException if the configuration file exists but cannot be read
     */
    public static DaemonConfig load() throws IOException {
        Properties merged = new Properties();
        Path file = Path.of(System.getProperty(CONFIG_FILE, DEFAULT_CONFIG_FILE));
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                merged.load(in);
            }
            logger.fine("Loaded configuration from " + file);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                merged.setProperty(name, System.getProperty(name));
            }
        }
        return new DaemonConfig(merged);
    }

    public Path getJobTable() {
        return Path.of(properties.getProperty(CRONTAB, "/etc/pgcrontab"));
    }

    public Path getPidFile() {
        return Path.of(properties.getProperty(PIDFILE, "/var/run/pgcrond.pid"));
    }

    /**
     * Get the daemon log file, or null when logging to a file is switched off
     * (an empty {@code pgcrond.logfile}).
     */
    public Path getLogFile() {
        String value = properties.getProperty(LOGFILE, "/var/log/pgcrond.log");
        return value.isBlank() ? null : Path.of(value);
    }

    /**
     * Get the configured password store, or null to use {@code ~/.pgpass}.
     */
    public Path getPasswordStore() {
        String value = properties.getProperty(PGPASS);
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    public String getSendmail() {
        return properties.getProperty(SENDMAIL, "/usr/sbin/sendmail");
    }

    public Isolation getIsolation() {
        String value = properties.getProperty(ISOLATION, "process").trim().toUpperCase(Locale.ROOT);
        try {
            return Isolation.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(ISOLATION + " must be 'process' or 'thread', got '" + value + "'", e);
        }
    }

    public int getWorkers() {
        return positiveInt(WORKERS, 4);
    }

    public Duration getTickInterval() {
        return Duration.ofMillis(positiveInt(TICK_MILLIS, 1000));
    }

    public int getStopAttempts() {
        return positiveInt(STOP_ATTEMPTS, 25);
    }

    public boolean isKillJobsOnStop() {
        return Boolean.parseBoolean(properties.getProperty(STOP_KILL_JOBS, "false").trim());
    }

    /**
     * Get the per-job deadline; zero means jobs may run forever.
     */
    public Duration getJobTimeout() {
        String value = properties.getProperty(JOB_TIMEOUT_SECONDS, "0").trim();
        try {
            long seconds = Long.parseLong(value);
            if (seconds < 0) {
                throw new IllegalArgumentException(JOB_TIMEOUT_SECONDS + " must not be negative");
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(JOB_TIMEOUT_SECONDS + " is not a number: " + value, e);
        }
    }

    public boolean isReportUnrunnable() {
        return Boolean.parseBoolean(properties.getProperty(REPORT_UNRUNNABLE, "false").trim());
    }

    /**
     * Render the {@code pgcrond.*} settings as {@code -D} arguments for a child JVM.
     */
    public List<String> toJvmArguments() {
        List<String> args = new ArrayList<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                args.add("-D" + name + "=" + properties.getProperty(name));
            }
        }
        args.sort(null);
        return args;
    }

    private int positiveInt(String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(key + " must be at least 1, got " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }
}
