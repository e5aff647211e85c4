package ai.rplayground.worker;

import static org.junit.jupiter.api.Assertions.*;

import ai.rplayground.testutil.ScriptedLauncher;
import ai.rplayground.worker.InterpreterWorker.WorkerException;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SharedWorkerFactoryTest {
    @TempDir
    Path tempDir;

    private SharedWorkerFactory factory;

    @BeforeEach
    void setUp() {
        factory = new SharedWorkerFactory(new ScriptedLauncher(), tempDir, Duration.ofSeconds(60));
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void testSessionsShareProcessButNotBindings() throws Exception {
        var a = factory.create("a", tempDir);
        var b = factory.create("b", tempDir);
        a.initialize();
        b.initialize();

        a.run("x <- 100");
        b.run("x <- 200");

        assertEquals("[1] 100", a.run("x").value());
        assertEquals("[1] 200", b.run("x").value());
    }

    @Test
    void testShutdownOfOneSessionKeepsOthersRunning() throws Exception {
        var a = factory.create("a", tempDir);
        var b = factory.create("b", tempDir);
        a.initialize();
        b.initialize();
        b.run("y <- 5");

        a.shutdown();

        assertFalse(a.isAlive());
        assertTrue(b.isAlive());
        assertEquals("[1] 5", b.run("y").value());
    }

    @Test
    void testCrashTakesDownEverySessionAndIsReplaced() throws Exception {
        var a = factory.create("a", tempDir);
        var b = factory.create("b", tempDir);
        a.initialize();
        b.initialize();

        assertThrows(WorkerException.class, () -> a.run("crash()"));

        assertFalse(a.isAlive());
        assertFalse(b.isAlive());
        assertThrows(WorkerException.class, () -> b.run("1"));

        var c = factory.create("c", tempDir);
        c.initialize();
        assertEquals("[1] 3", c.run("1 + 2").value());
    }

    @Test
    void testClosedFactoryRefusesNewSessions() {
        factory.close();
        var worker = factory.create("late", tempDir);

        assertThrows(WorkerException.class, worker::initialize);
    }
}
