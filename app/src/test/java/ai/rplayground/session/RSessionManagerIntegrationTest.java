package ai.rplayground.session;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.testutil.RTestSupport;
import ai.rplayground.worker.WorkerStrategy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs against a real R installation; skipped when none is available.
 */
class RSessionManagerIntegrationTest {
    @TempDir
    Path tempDir;

    private RSessionManager manager;

    @BeforeAll
    static void requireR() {
        assumeTrue(RTestSupport.isRAvailable(), "R is not installed");
    }

    @BeforeEach
    void setUp() {
        manager = RSessionManager.fromConfig(PlaygroundConfig.load().withTempRoot(tempDir));
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    void testArithmeticAndState() throws Exception {
        var id = manager.createSession();

        assertTrue(manager.executeInSession(id, "1 + 1").successfulOutput().contains("2"));
        manager.executeInSession(id, "x <- 42");
        assertTrue(manager.executeInSession(id, "x * 2").successfulOutput().contains("84"));
    }

    @Test
    void testErrors() throws Exception {
        var id = manager.createSession();

        var missing = manager.executeInSession(id, "no_such_object");
        assertTrue(missing.interpreterErrorOutput().contains("not found"), missing.interpreterErrorOutput());

        var parse = manager.executeInSession(id, "x <- (1 + ");
        assertTrue(parse.interpreterErrorOutput().startsWith("R parsing error: "));
    }

    @Test
    void testConsoleOutputAndPrintedValue() throws Exception {
        var id = manager.createSession();

        var printed = manager.executeInSession(id, "print(5)");
        assertEquals("[1] 5", printed.successfulOutput().strip());

        var invisible = manager.executeInSession(id, "invisible(7)");
        assertEquals("", invisible.successfulOutput());

        var warned = manager.executeInSession(id, "warning(\"careful\"); 1");
        assertTrue(warned.successfulOutput().contains("careful"));
    }

    @Test
    void testImageRoundTrip() throws Exception {
        var id = manager.createSession();

        var plot = manager.executeInSession(
                id,
                "png(get_img_dest_file_name(), width = 320, height = 240)\nplot(1:10)\ninvisible(dev.off())");
        var next = manager.executeInSession(id, "1");

        assertNotNull(plot.successfulOutput(), () -> String.valueOf(plot.interpreterErrorOutput()) + plot.hostErrorOutput());
        assertEquals(1, plot.images().size());
        assertEquals(320, plot.images().get(0).width());
        assertEquals(240, plot.images().get(0).height());
        assertEquals(0, next.images().size());
    }

    @Test
    void testImageHelperLeavesRandomStateAlone() throws Exception {
        var id = manager.createSession();

        var first = manager.executeInSession(id, "set.seed(1); invisible(get_img_dest_file_name()); runif(1)");
        var second = manager.executeInSession(id, "set.seed(1); runif(1)");

        assertEquals(second.successfulOutput(), first.successfulOutput());
    }

    @Test
    void testConcurrentStress() throws Exception {
        var expected = Map.of(100, 403, 200, 803, 300, 1203);
        var futures = new HashMap<Integer, CompletableFuture<ExecutionResult>>();
        for (var base : expected.keySet()) {
            var id = manager.createSession();
            futures.put(base, CompletableFuture.supplyAsync(() -> {
                for (var step : List.of(
                        "counter <- " + base, "aggregate <- sum(1:2) + counter * 3", "counter <- counter + aggregate")) {
                    manager.executeInSession(id, step);
                }
                return manager.executeInSession(id, "counter");
            }));
        }
        for (var entry : expected.entrySet()) {
            var output = futures.get(entry.getKey()).get(120, TimeUnit.SECONDS).successfulOutput();
            assertEquals("[1] " + entry.getValue(), output.strip());
        }
    }

    @Test
    void testTimeoutKillsSession() throws Exception {
        var id = manager.createSession();

        var result = manager.executeInSession(id, "Sys.sleep(60)", Duration.ofSeconds(2));

        assertTrue(result.hostErrorOutput().contains("timed out"));
        assertFalse(manager.sessionIds().contains(id));
    }

    @Test
    void testSharedStrategyIsolatesBindings() throws Exception {
        manager.close();
        manager = RSessionManager.fromConfig(
                PlaygroundConfig.load().withTempRoot(tempDir).withWorkerStrategy(WorkerStrategy.SHARED));
        var a = manager.createSession("A");
        var b = manager.createSession("B");

        manager.executeInSession(a, "x <- 100");
        manager.executeInSession(b, "x <- 200");

        assertEquals("[1] 100", manager.executeInSession(a, "x").successfulOutput().strip());
        assertEquals("[1] 200", manager.executeInSession(b, "x").successfulOutput().strip());
    }
}
