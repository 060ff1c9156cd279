package com.pgcrond.test;

import com.pgcrond.core.JobType;
import com.pgcrond.engine.NotificationPolicy;
import org.junit.jupiter.api.*;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for which job output turns into a report.
 */
public class NotificationPolicyTest {

    private final NotificationPolicy policy = new NotificationPolicy();

    @Test
    public void testSlowPsqlTimingIsReported() {
        String output = "SELECT 1;\nTime: 12345.678 ms\n";
        assertEquals(Optional.of(output), policy.evaluate(JobType.PSQL, output));
    }

    @Test
    public void testFastPsqlTimingIsNotReported() {
        assertTrue(policy.evaluate(JobType.PSQL, "Time: 12.3 ms\n").isEmpty());
        assertTrue(policy.evaluate(JobType.PSQL, "Time: 9999.999 ms\n").isEmpty(), "Just under ten seconds");
    }

    @Test
    public void testPsqlWarningsAndErrorsAreReported() {
        assertTrue(policy.evaluate(JobType.PSQL, "psql:job.sql:3: ERROR:  relation \"x\" does not exist\n").isPresent());
        assertTrue(policy.evaluate(JobType.PSQL, "WARNING:  there is no transaction in progress\n").isPresent());
    }

    @Test
    public void testRoutinePsqlOutputIsNotReported() {
        assertTrue(policy.evaluate(JobType.PSQL, "VACUUM\nCOMMIT\n").isEmpty());
    }

    @Test
    public void testShellAndScriptOutputIsAlwaysReported() {
        assertEquals(Optional.of("done\n"), policy.evaluate(JobType.SHELL, "done\n"));
        assertEquals(Optional.of("rows: 3"), policy.evaluate(JobType.EMBEDDED_SCRIPT, "rows: 3"));
    }

    @Test
    public void testDirectOutputIsNeverReported() {
        assertTrue(policy.evaluate(JobType.DIRECT, "ERROR").isEmpty());
    }

    @Test
    public void testEmptyOutputIsNeverReported() {
        for (JobType type : JobType.values()) {
            assertTrue(policy.evaluate(type, "").isEmpty(), type.toString());
            assertTrue(policy.evaluate(type, null).isEmpty(), type.toString());
        }
    }

    /**
     * A bare newline from a shell or script job is still output.
     */
    @Test
    public void testWhitespaceOnlyShellAndScriptOutputIsReported() {
        assertEquals(Optional.of("\n"), policy.evaluate(JobType.SHELL, "\n"));
        assertEquals(Optional.of("  \n"), policy.evaluate(JobType.EMBEDDED_SCRIPT, "  \n"));
        assertTrue(policy.evaluate(JobType.PSQL, "\n").isEmpty());
        assertTrue(policy.evaluate(JobType.DIRECT, "\n").isEmpty());
    }
}
