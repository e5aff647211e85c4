package ai.rplayground.worker;

import ai.rplayground.config.PlaygroundConfig;
import java.nio.file.Path;

/**
 * Creates the worker backing a new session. Factories may own shared resources, released by {@link #close()}.
 */
public interface WorkerFactory extends AutoCloseable {
    /**
     * @param sessionId the session the worker will serve
     * @param plotDir the session's private directory that image helper paths point into
     * @return a new, not yet initialized worker
     */
    InterpreterWorker create(String sessionId, Path plotDir);

    @Override
    void close();

    static WorkerFactory forConfig(PlaygroundConfig config) {
        var launcher = RInstallation.fromConfig(config);
        return switch (config.workerStrategy()) {
            case SUBPROCESS -> new SubprocessWorkerFactory(launcher, config.tempRoot(), config.workerStartupTimeout());
            case SHARED -> new SharedWorkerFactory(launcher, config.tempRoot(), config.workerStartupTimeout());
        };
    }
}
