package com.pgcrond.test;

import com.pgcrond.app.DaemonConfig;
import com.pgcrond.app.Main;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for configuration loading and the command line surface.
 */
public class DaemonConfigTest {

    @TempDir
    Path dir;

    private static DaemonConfig config(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new DaemonConfig(properties);
    }

    @AfterEach
    public void clearSystemProperties() {
        System.clearProperty(DaemonConfig.CONFIG_FILE);
        System.clearProperty(DaemonConfig.PIDFILE);
        System.clearProperty(DaemonConfig.WORKERS);
    }

    @Test
    public void testDefaults() {
        DaemonConfig config = config();

        assertEquals(Path.of("/etc/pgcrontab"), config.getJobTable());
        assertEquals(Path.of("/var/run/pgcrond.pid"), config.getPidFile());
        assertEquals(Path.of("/var/log/pgcrond.log"), config.getLogFile());
        assertNull(config.getPasswordStore());
        assertEquals("/usr/sbin/sendmail", config.getSendmail());
        assertEquals(DaemonConfig.Isolation.PROCESS, config.getIsolation());
        assertEquals(Duration.ofSeconds(1), config.getTickInterval());
        assertEquals(25, config.getStopAttempts());
        assertFalse(config.isKillJobsOnStop());
        assertEquals(Duration.ZERO, config.getJobTimeout());
        assertFalse(config.isReportUnrunnable());
    }

    @Test
    public void testExplicitValues() {
        DaemonConfig config = config(
                DaemonConfig.ISOLATION, "Thread",
                DaemonConfig.WORKERS, "8",
                DaemonConfig.JOB_TIMEOUT_SECONDS, "3600",
                DaemonConfig.STOP_KILL_JOBS, "true",
                DaemonConfig.LOGFILE, "");

        assertEquals(DaemonConfig.Isolation.THREAD, config.getIsolation());
        assertEquals(8, config.getWorkers());
        assertEquals(Duration.ofHours(1), config.getJobTimeout());
        assertTrue(config.isKillJobsOnStop());
        assertNull(config.getLogFile(), "An empty log file setting disables file logging");
    }

    @Test
    public void testInvalidNumbersNameTheKey() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> config(DaemonConfig.STOP_ATTEMPTS, "lots").getStopAttempts());
        assertTrue(e.getMessage().contains(DaemonConfig.STOP_ATTEMPTS));

        e = assertThrows(IllegalArgumentException.class, () -> config(DaemonConfig.WORKERS, "0").getWorkers());
        assertTrue(e.getMessage().contains(DaemonConfig.WORKERS));

        assertThrows(IllegalArgumentException.class, () -> config(DaemonConfig.ISOLATION, "fiber").getIsolation());
    }

    @Test
    public void testFileIsOverriddenBySystemProperties() throws Exception {
        Path file = dir.resolve("pgcrond.properties");
        Files.writeString(file, "pgcrond.crontab=/srv/pgcrontab\npgcrond.workers=2\n");
        System.setProperty(DaemonConfig.CONFIG_FILE, file.toString());
        System.setProperty(DaemonConfig.WORKERS, "6");

        DaemonConfig config = DaemonConfig.load();

        assertEquals(Path.of("/srv/pgcrontab"), config.getJobTable());
        assertEquals(6, config.getWorkers());
    }

    @Test
    public void testJvmArgumentsCarryEverySetting() {
        List<String> args = config(DaemonConfig.CRONTAB, "/srv/pgcrontab", DaemonConfig.WORKERS, "3",
                "unrelated.key", "x").toJvmArguments();

        assertEquals(List.of("-Dpgcrond.crontab=/srv/pgcrontab", "-Dpgcrond.workers=3"), args);
    }

    @Test
    public void testUsageForUnknownOrMissingCommand() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        assertEquals(0, Main.execute(new String[0], print(out), print(err)));
        assertEquals(0, Main.execute(new String[]{"frobnicate"}, print(out), print(err)));
        assertEquals(0, Main.execute(new String[]{"help"}, print(out), print(err)));

        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: pgcrond"));
    }

    @Test
    public void testVersion() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(0, Main.execute(new String[]{"version"}, print(out), print(new ByteArrayOutputStream())));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("pgcrond "));
    }

    @Test
    public void testStatusWhenStopped() {
        System.setProperty(DaemonConfig.CONFIG_FILE, dir.resolve("absent.properties").toString());
        System.setProperty(DaemonConfig.PIDFILE, dir.resolve("pgcrond.pid").toString());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(1, Main.execute(new String[]{"status"}, print(out), print(new ByteArrayOutputStream())));
        assertEquals("Stopped", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    public void testStopWhenNotStarted() {
        System.setProperty(DaemonConfig.CONFIG_FILE, dir.resolve("absent.properties").toString());
        System.setProperty(DaemonConfig.PIDFILE, dir.resolve("pgcrond.pid").toString());
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        assertEquals(1, Main.execute(new String[]{"stop"}, print(new ByteArrayOutputStream()), print(err)));
        assertEquals("pgcrond: not started", err.toString(StandardCharsets.UTF_8).trim());
    }

    private static PrintStream print(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }
}
