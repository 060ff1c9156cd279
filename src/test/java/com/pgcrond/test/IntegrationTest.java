package com.pgcrond.test;

import com.pgcrond.core.JobType;
import com.pgcrond.core.VariableSet;
import com.pgcrond.crontab.JobTableParser;
import com.pgcrond.db.CredentialResolver;
import com.pgcrond.engine.CronTimeMatcher;
import com.pgcrond.engine.InlineJobLauncher;
import com.pgcrond.engine.JobDispatcher;
import com.pgcrond.engine.JobExecution;
import com.pgcrond.engine.NotificationPolicy;
import com.pgcrond.engine.Reporter;
import com.pgcrond.engine.Scheduler;
import com.pgcrond.exec.SystemProcessRunner;
import com.pgcrond.jobs.JobHandlers;
import com.pgcrond.jobs.ScriptJob;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: job table on disk, scheduler tick, in-process execution of
 * every job type, reports collected by a recording notifier.
 */
public class IntegrationTest {

    @TempDir
    Path dir;

    private RecordingNotifier notifier;
    private InlineJobLauncher launcher;
    private MutableClock clock;
    private Scheduler scheduler;
    private Path table;

    @BeforeEach
    public void setUp() throws Exception {
        try (Connection conn = H2Connector.open("integration");
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS ticks");
            stmt.execute("CREATE TABLE ticks (n INT)");
        }
        Path passwordStore = Files.writeString(dir.resolve("pgpass"), "*:*:integration:batch:pw\n");
        Files.writeString(dir.resolve("hello.tst"), "def run\necho script saw ${PGUSER}@${PGDATABASE}\n");

        notifier = new RecordingNotifier();
        SystemProcessRunner processRunner = new SystemProcessRunner();
        JobHandlers handlers = JobHandlers.defaults()
                .with(JobType.EMBEDDED_SCRIPT, new ScriptJob(LineScriptEngineFactory.manager()));
        JobExecution execution = new JobExecution(new CredentialResolver(passwordStore), handlers,
                new NotificationPolicy(), new Reporter(notifier), new H2Connector(), processRunner, false);

        launcher = new InlineJobLauncher(4, execution);
        table = dir.resolve("pgcrontab");
        clock = new MutableClock(Instant.parse("2026-10-18T02:30:00Z"), ZoneId.of("UTC"));
        scheduler = new Scheduler(table, new JobTableParser(), new CronTimeMatcher(), new JobDispatcher(launcher),
                clock, Duration.ofMillis(10));
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        launcher.shutdown(false);
        launcher.awaitTermination(10, TimeUnit.SECONDS);
    }

    private static int ticks() throws Exception {
        try (Connection conn = H2Connector.open("integration");
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM ticks")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    /**
     * Every due job runs once; only the noteworthy ones produce mail.
     */
    @Test
    public void testTickRunsEveryJobType() throws Exception {
        Files.write(table, List.of(
                "MAILTO = ops@example.com",
                "PGDATABASE = integration",
                "PGUSER = batch",
                "PGPASSWORD = ignored",
                "SCRIPTHOME = " + dir,
                "",
                "# m h dom mon dow  server port db user schema type command",
                "*  *  *   *   *    -      -    -  -    -      direct INSERT INTO ticks VALUES (1)",
                "*  *  *   *   *    -      -    -  -    -      sh     echo shell saw $PGDATABASE",
                "*  *  *   *   *    -      -    -  -    -      perl   hello.tst",
                "*  *  *   *   *    -      -    -  -    -      psql   missing.sql",
                "0  0  1   1   *    -      -    -  -    -      sh     echo not due"));
        notifier.expect(3);

        assertTrue(scheduler.pollOnce());
        assertTrue(notifier.await(20, TimeUnit.SECONDS), "Three reports expected, got " + notifier.getMessages());
        launcher.shutdown(false);
        assertTrue(launcher.awaitTermination(20, TimeUnit.SECONDS));

        assertEquals(1, ticks());
        List<RecordingNotifier.Message> messages = notifier.getMessages().stream()
                .sorted(Comparator.comparing(m -> m.subject))
                .collect(Collectors.toList());
        assertEquals(3, messages.size(), messages.toString());
        assertEquals(List.of("pgcrond: echo shell saw $PGDATABASE", "pgcrond: hello.tst", "pgcrond: missing.sql"),
                messages.stream().map(m -> m.subject).collect(Collectors.toList()));

        assertTrue(messages.get(0).body.endsWith("\nshell saw integration\n"), messages.get(0).body);
        assertTrue(messages.get(1).body.endsWith("\nscript saw batch@integration\n"), messages.get(1).body);
        assertTrue(messages.get(2).body.endsWith("\nInvalid PostgreSQL session file provided"), messages.get(2).body);
        for (RecordingNotifier.Message message : messages) {
            assertEquals("ops@example.com", message.to);
            assertTrue(message.body.startsWith("Server:   localhost\nDatabase: integration\nUser:     batch\n"));
            assertFalse(message.body.contains("pw"), "Passwords never reach a report");
        }
    }

    /**
     * A second poll within the same minute runs nothing; the next minute runs again.
     */
    @Test
    public void testJobsRunOncePerMinute() throws Exception {
        Files.write(table, List.of(
                "PGDATABASE = integration",
                "PGUSER = batch",
                "* * * * * - - - - - direct INSERT INTO ticks VALUES (1)"));

        scheduler.pollOnce();
        clock.advance(Duration.ofSeconds(30));
        scheduler.pollOnce();
        clock.advance(Duration.ofSeconds(30));
        scheduler.pollOnce();
        launcher.shutdown(false);
        assertTrue(launcher.awaitTermination(20, TimeUnit.SECONDS));

        assertEquals(2, ticks());
        assertTrue(notifier.getMessages().isEmpty());
    }

    /**
     * A failing statement is reported and does not disturb its neighbours.
     */
    @Test
    public void testFailureIsReportedAndIsolated() throws Exception {
        Files.write(table, List.of(
                "PGDATABASE = integration",
                "PGUSER = batch",
                "* * * * * - - - - - direct INSERT INTO no_such_table VALUES (1)",
                "* * * * * - - - - - direct INSERT INTO ticks VALUES (1)"));
        notifier.expect(1);

        scheduler.pollOnce();
        assertTrue(notifier.await(20, TimeUnit.SECONDS));
        launcher.shutdown(false);
        assertTrue(launcher.awaitTermination(20, TimeUnit.SECONDS));

        assertEquals(1, ticks());
        RecordingNotifier.Message message = notifier.only();
        assertEquals(VariableSet.DEFAULT_MAILTO, message.to);
        assertTrue(message.body.contains("Error performing SQL operation: "), message.body);
    }
}
