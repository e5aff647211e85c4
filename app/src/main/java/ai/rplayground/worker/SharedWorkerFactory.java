package ai.rplayground.worker;

import ai.rplayground.worker.InterpreterWorker.WorkerException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Hosts every session in one interpreter process, each in its own environment.
 *
 * <p>All sessions share the process's request lock, so evaluations are serialized across sessions,
 * and a fatal error in one session's code takes the others down with it. A dead shared process
 * is replaced on the next session initialization.
 */
public final class SharedWorkerFactory implements WorkerFactory {
    private static final Logger logger = LogManager.getLogger(SharedWorkerFactory.class);

    private final InterpreterLauncher launcher;
    private final Path tempRoot;
    private final Duration startupTimeout;
    private final AtomicInteger generation = new AtomicInteger();

    @Nullable
    private RProcess shared;

    private boolean closed;

    public SharedWorkerFactory(InterpreterLauncher launcher, Path tempRoot, Duration startupTimeout) {
        this.launcher = launcher;
        this.tempRoot = tempRoot;
        this.startupTimeout = startupTimeout;
    }

    @Override
    public InterpreterWorker create(String sessionId, Path plotDir) {
        return new SharedProcessWorker(sessionId, plotDir, this);
    }

    synchronized RProcess acquire() throws WorkerException {
        if (closed) {
            throw new WorkerException("Shared interpreter has been closed");
        }
        if (shared != null && shared.isAlive()) {
            return shared;
        }
        if (shared != null) {
            logger.warn("Shared interpreter {} is gone; starting a replacement", shared.name());
            shared.close();
        }
        shared = RProcess.start("shared-" + generation.incrementAndGet(), launcher, tempRoot, startupTimeout);
        return shared;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (shared != null) {
            shared.close();
            shared = null;
        }
    }

    private static final class SharedProcessWorker extends AbstractRWorker {
        private final SharedWorkerFactory factory;

        SharedProcessWorker(String sessionId, Path plotDir, SharedWorkerFactory factory) {
            super(sessionId, plotDir);
            this.factory = factory;
        }

        @Override
        protected RProcess acquireProcess() throws WorkerException {
            return factory.acquire();
        }

        @Override
        protected void releaseProcess(RProcess process) {
            // the factory owns the shared process
        }

        @Override
        protected void terminateProcess(RProcess process) {
            // the only way to abort an evaluation is to kill the interpreter every session shares
            logger.warn("Terminating shared interpreter {} on behalf of session {}", process.name(), sessionId);
            process.terminate();
        }
    }
}
