package ai.rplayground.worker;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * State machine shared by the R-backed workers: NEW, then READY after {@link #initialize()},
 * then SHUT_DOWN for good. Subclasses decide where the {@link RProcess} comes from and
 * what releasing it means.
 */
abstract class AbstractRWorker implements InterpreterWorker {
    private static final Logger logger = LogManager.getLogger(AbstractRWorker.class);
    private static final AtomicLong ENVIRONMENT_IDS = new AtomicLong();

    static final Duration CLOSE_GRACE = Duration.ofSeconds(2);

    private enum State {
        NEW,
        READY,
        SHUT_DOWN
    }

    protected final String sessionId;
    protected final Path plotDir;
    protected final String environmentName;

    private final Object stateLock = new Object();
    private State state = State.NEW;

    @Nullable
    private RProcess process;

    protected AbstractRWorker(String sessionId, Path plotDir) {
        this.sessionId = sessionId;
        this.plotDir = plotDir;
        // derived from a counter, never from the caller-supplied session id
        this.environmentName = "session_env_" + ENVIRONMENT_IDS.incrementAndGet();
    }

    /**
     * Obtain a running process to host this worker's environment.
     */
    protected abstract RProcess acquireProcess() throws WorkerException;

    /**
     * Give the process back once the environment has been closed (or closing failed).
     */
    protected abstract void releaseProcess(RProcess process);

    @Override
    public void initialize() throws WorkerException {
        synchronized (stateLock) {
            if (state == State.READY) {
                return;
            }
            if (state == State.SHUT_DOWN) {
                throw new NotInitializedException("Worker for session " + sessionId + " has been shut down");
            }

            var acquired = acquireProcess();
            try {
                acquired.openEnvironment(environmentName, plotDir);
            } catch (WorkerException e) {
                releaseProcess(acquired);
                throw e;
            }
            process = acquired;
            state = State.READY;
            logger.info(
                    "Initialized worker for session {} (env={}, process={})",
                    sessionId,
                    environmentName,
                    acquired.name());
        }
    }

    @Override
    public RawResult run(String code) throws WorkerException {
        RProcess current;
        synchronized (stateLock) {
            if (state != State.READY || process == null) {
                throw new NotInitializedException("Worker for session " + sessionId + " is not initialized");
            }
            current = process;
        }
        return current.evaluate(environmentName, code);
    }

    @Override
    public void shutdownOrThrow() throws WorkerException {
        RProcess current;
        synchronized (stateLock) {
            if (state == State.SHUT_DOWN) {
                return;
            }
            state = State.SHUT_DOWN;
            current = process;
            process = null;
        }
        if (current == null) {
            return;
        }

        logger.debug("Shutting down worker for session {} (env={})", sessionId, environmentName);
        try {
            if (current.isAlive()) {
                current.closeEnvironment(environmentName, CLOSE_GRACE);
            }
        } finally {
            releaseProcess(current);
        }
    }

    @Override
    public void shutdown() {
        try {
            shutdownOrThrow();
        } catch (WorkerException e) {
            logger.warn("Error shutting down worker for session {}: {}", sessionId, e.getMessage());
        }
    }

    @Override
    public void terminate() {
        RProcess current;
        synchronized (stateLock) {
            state = State.SHUT_DOWN;
            current = process;
            process = null;
        }
        if (current != null) {
            logger.warn("Terminating worker for session {}", sessionId);
            terminateProcess(current);
        }
    }

    /**
     * Forcibly stop the process backing this worker.
     */
    protected void terminateProcess(RProcess process) {
        process.terminate();
        process.close();
    }

    @Override
    public boolean isAlive() {
        synchronized (stateLock) {
            if (state == State.SHUT_DOWN) {
                return false;
            }
            return process == null || process.isAlive();
        }
    }
}
