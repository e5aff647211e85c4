package ai.rplayground.worker;

import java.nio.file.Path;
import java.time.Duration;

public final class SubprocessWorkerFactory implements WorkerFactory {
    private final InterpreterLauncher launcher;
    private final Path tempRoot;
    private final Duration startupTimeout;

    public SubprocessWorkerFactory(InterpreterLauncher launcher, Path tempRoot, Duration startupTimeout) {
        this.launcher = launcher;
        this.tempRoot = tempRoot;
        this.startupTimeout = startupTimeout;
    }

    @Override
    public InterpreterWorker create(String sessionId, Path plotDir) {
        return new SubprocessWorker(sessionId, plotDir, launcher, tempRoot, startupTimeout);
    }

    @Override
    public void close() {
        // every worker owns and releases its own process
    }
}
