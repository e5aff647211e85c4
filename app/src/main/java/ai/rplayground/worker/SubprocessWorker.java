package ai.rplayground.worker;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Worker that owns a dedicated interpreter process. A crash or runaway evaluation only affects
 * the session using it.
 */
public final class SubprocessWorker extends AbstractRWorker {
    private final InterpreterLauncher launcher;
    private final Path tempRoot;
    private final Duration startupTimeout;

    public SubprocessWorker(
            String sessionId, Path plotDir, InterpreterLauncher launcher, Path tempRoot, Duration startupTimeout) {
        super(sessionId, plotDir);
        this.launcher = launcher;
        this.tempRoot = tempRoot;
        this.startupTimeout = startupTimeout;
    }

    @Override
    protected RProcess acquireProcess() throws WorkerException {
        return RProcess.start("session-" + sessionId, launcher, tempRoot, startupTimeout);
    }

    @Override
    protected void releaseProcess(RProcess process) {
        process.close();
    }
}
