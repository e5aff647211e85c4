package ai.rplayground.worker;

import static org.junit.jupiter.api.Assertions.*;

import ai.rplayground.config.PlaygroundConfig;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkerFactoryTest {
    @TempDir
    Path tempDir;

    @Test
    void testStrategySelectsFactory() {
        var config = PlaygroundConfig.defaults().withTempRoot(tempDir);

        try (var subprocess = WorkerFactory.forConfig(config);
                var shared = WorkerFactory.forConfig(config.withWorkerStrategy(WorkerStrategy.SHARED))) {
            assertInstanceOf(SubprocessWorkerFactory.class, subprocess);
            assertInstanceOf(SharedWorkerFactory.class, shared);
            assertInstanceOf(SubprocessWorker.class, subprocess.create("s1", tempDir));
        }
    }

    @Test
    void testWorkersAreCreatedUninitialized() {
        try (var factory = WorkerFactory.forConfig(PlaygroundConfig.defaults().withTempRoot(tempDir))) {
            var worker = factory.create("s1", tempDir);

            assertTrue(worker.isAlive());
            assertThrows(InterpreterWorker.NotInitializedException.class, () -> worker.run("1"));
        }
    }
}
