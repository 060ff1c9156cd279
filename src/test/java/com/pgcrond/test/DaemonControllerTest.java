package com.pgcrond.test;

import com.pgcrond.app.DaemonController;
import com.pgcrond.app.DaemonException;
import com.pgcrond.app.DaemonState;
import com.pgcrond.app.PidFile;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the start/stop/status lifecycle against a fake process table.
 */
public class DaemonControllerTest {

    private static final long SELF = 1000;

    @TempDir
    Path dir;

    private PidFile pidFile;
    private FakeProcessTable processes;
    private AtomicInteger launches;

    @BeforeEach
    public void setUp() {
        pidFile = new PidFile(dir.resolve("run/pgcrond.pid"));
        processes = new FakeProcessTable(SELF);
        launches = new AtomicInteger();
    }

    private DaemonController controller(int stopAttempts) {
        return controller(stopAttempts, () -> {
            launches.incrementAndGet();
            return new FakeProcess(false, 1);
        });
    }

    private DaemonController controller(int stopAttempts, com.pgcrond.app.DaemonLauncher launcher) {
        return new DaemonController(pidFile, processes, launcher, stopAttempts, Duration.ZERO, Duration.ofSeconds(2));
    }

    @Test
    public void testStatusOfLiveDaemon() throws Exception {
        pidFile.write(4242);
        processes.addLive(4242);

        assertEquals(OptionalLong.of(4242), controller(3).status());
        assertEquals(DaemonState.RUNNING, controller(3).getState());
    }

    @Test
    public void testStatusWithoutPidFile() throws Exception {
        assertTrue(controller(3).status().isEmpty());
        assertEquals(DaemonState.STOPPED, controller(3).getState());
    }

    @Test
    public void testStalePidFileIsRemovedByStatus() throws Exception {
        pidFile.write(4242);

        assertTrue(controller(3).status().isEmpty());
        assertFalse(pidFile.exists());
    }

    @Test
    public void testGarbagePidFileIsTreatedAsStale() throws Exception {
        Files.createDirectories(pidFile.getPath().getParent());
        Files.writeString(pidFile.getPath(), "not-a-pid\n");

        assertTrue(controller(3).status().isEmpty());
        assertFalse(pidFile.exists());
    }

    @Test
    public void testStopWithStalePidReportsNotStarted() throws IOException {
        pidFile.write(4242);

        DaemonException e = assertThrows(DaemonException.class, () -> controller(3).stop());

        assertEquals("not started", e.getMessage());
        assertFalse(pidFile.exists(), "Stale PID file is deleted as a side effect");
        assertEquals(0, processes.getSignalCount());
    }

    @Test
    public void testStopSignalsUntilProcessExits() throws Exception {
        pidFile.write(4242);
        processes.addLive(4242);
        processes.dieAfter(4242, 2);

        controller(25).stop();

        assertEquals(2, processes.getSignalCount());
        assertFalse(processes.isLive(4242));
        assertFalse(pidFile.exists());
    }

    @Test
    public void testStopTimesOutAfterConfiguredAttempts() throws IOException {
        pidFile.write(4242);
        processes.addLive(4242);

        DaemonException e = assertThrows(DaemonException.class, () -> controller(3).stop());

        assertEquals("timeout", e.getMessage());
        assertEquals(3, processes.getSignalCount());
        assertTrue(pidFile.exists());
    }

    @Test
    public void testStartRefusedWhenRunning() throws IOException {
        pidFile.write(4242);
        processes.addLive(4242);

        DaemonException e = assertThrows(DaemonException.class, () -> controller(3).start());

        assertTrue(e.getMessage().startsWith("already running"), e.getMessage());
        assertEquals(0, launches.get());
    }

    @Test
    public void testStartWaitsForDaemonToRecordPid() throws Exception {
        DaemonController controller = controller(3, () -> {
            pidFile.write(5151);
            processes.addLive(5151);
            return new FakeProcess(true, 0);
        });

        assertEquals(5151, controller.start());
    }

    @Test
    public void testStartFailsWhenDaemonExitsEarly() {
        DaemonException e = assertThrows(DaemonException.class, () -> controller(3).start());

        assertTrue(e.getMessage().contains("status 1"), e.getMessage());
        assertEquals(1, launches.get());
    }

    @Test
    public void testStartFailsWhenSpawnFails() {
        DaemonController controller = controller(3, () -> {
            throw new IOException("setsid: not found");
        });

        DaemonException e = assertThrows(DaemonException.class, controller::start);
        assertTrue(e.getMessage().contains("setsid: not found"));
    }

    @Test
    public void testRestartStopsThenStarts() throws Exception {
        pidFile.write(4242);
        processes.addLive(4242);
        processes.dieAfter(4242, 1);
        DaemonController controller = controller(3, () -> {
            pidFile.write(5151);
            processes.addLive(5151);
            return new FakeProcess(true, 0);
        });

        assertEquals(5151, controller.restart());
    }

    @Test
    public void testRestartShortCircuitsWhenStopFails() {
        DaemonException e = assertThrows(DaemonException.class, () -> controller(3).restart());

        assertEquals("not started", e.getMessage());
        assertEquals(0, launches.get());
    }

    @Test
    public void testClaimAndRelease() throws Exception {
        DaemonController controller = controller(3);

        long pid = controller.claim();

        assertEquals(SELF, pid);
        assertEquals(OptionalLong.of(SELF), pidFile.read());

        controller.release(pid);
        assertFalse(pidFile.exists());
    }

    @Test
    public void testClaimRefusedWhenAnotherDaemonRuns() throws IOException {
        pidFile.write(4242);
        processes.addLive(4242);

        assertThrows(DaemonException.class, () -> controller(3).claim());
        assertEquals(OptionalLong.of(4242), pidFile.read());
    }

    @Test
    public void testReleaseLeavesForeignPidFile() throws Exception {
        pidFile.write(4242);

        controller(3).release(SELF);

        assertTrue(pidFile.exists());
    }

    @Test
    public void testDaemonStateTransitions() {
        assertTrue(DaemonState.STOPPED.canTransitionTo(DaemonState.STARTING));
        assertTrue(DaemonState.STARTING.canTransitionTo(DaemonState.RUNNING));
        assertTrue(DaemonState.RUNNING.canTransitionTo(DaemonState.STOPPING));
        assertTrue(DaemonState.STOPPING.canTransitionTo(DaemonState.STOPPED));
        assertFalse(DaemonState.STOPPED.canTransitionTo(DaemonState.RUNNING));
        assertEquals("Stopped", DaemonState.STOPPED.toString());
    }
}
