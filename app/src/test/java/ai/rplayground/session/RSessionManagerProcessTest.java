package ai.rplayground.session;

import static org.junit.jupiter.api.Assertions.*;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.testutil.ScriptedLauncher;
import ai.rplayground.worker.SharedWorkerFactory;
import ai.rplayground.worker.SubprocessWorkerFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Drives the manager over real child processes speaking the worker protocol.
 */
class RSessionManagerProcessTest {
    private static final Duration STARTUP = Duration.ofSeconds(60);

    @TempDir
    Path tempDir;

    private RSessionManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    private PlaygroundConfig config() {
        return PlaygroundConfig.defaults().withTempRoot(tempDir);
    }

    @Test
    void testSubprocessSessionsEndToEnd() throws Exception {
        manager = new RSessionManager(config(), new SubprocessWorkerFactory(new ScriptedLauncher(), tempDir, STARTUP));
        var a = manager.createSession("A");
        var b = manager.createSession("B");

        manager.executeInSession(a, "x <- 100");
        manager.executeInSession(b, "x <- 200");
        var plot = manager.executeInSession(a, "plot(50, 40)\nx");

        assertEquals("[1] 100", plot.successfulOutput());
        assertEquals(1, plot.images().size());
        assertEquals("[1] 200", manager.executeInSession(b, "x").successfulOutput());

        assertTrue(manager.destroySession(a));
        assertTrue(manager.destroySession(b));
        try (var leftovers = Files.list(tempDir)) {
            assertEquals(0, leftovers.count(), "session and exchange directories should be removed");
        }
    }

    @Test
    void testTimeoutKillsOnlyThatSession() throws Exception {
        manager = new RSessionManager(config(), new SubprocessWorkerFactory(new ScriptedLauncher(), tempDir, STARTUP));
        var slow = manager.createSession("slow");
        var other = manager.createSession("other");

        var result = manager.executeInSession(slow, "Sys.sleep(60)", Duration.ofSeconds(1));

        assertTrue(result.hostErrorOutput().contains("timed out"));
        assertFalse(manager.sessionIds().contains(slow));
        assertEquals("[1] 2", manager.executeInSession(other, "1 + 1").successfulOutput());
    }

    @Test
    void testSharedStrategyCrashAffectsAllSessions() throws Exception {
        manager = new RSessionManager(config(), new SharedWorkerFactory(new ScriptedLauncher(), tempDir, STARTUP));
        var a = manager.createSession("A");
        var b = manager.createSession("B");

        var crash = manager.executeInSession(a, "crash()");
        var victim = manager.executeInSession(b, "1");

        assertNotNull(crash.hostErrorOutput());
        assertNotNull(victim.hostErrorOutput());
        assertEquals(0, manager.size());

        var fresh = manager.createSession("C");
        assertEquals("[1] 3", manager.executeInSession(fresh, "1 + 2").successfulOutput());
    }
}
