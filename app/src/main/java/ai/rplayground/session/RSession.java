package ai.rplayground.session;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.session.SessionManager.SessionException;
import ai.rplayground.util.FileUtil;
import ai.rplayground.worker.InterpreterWorker;
import ai.rplayground.worker.InterpreterWorker.WorkerException;
import ai.rplayground.worker.RawResult;
import ai.rplayground.worker.WorkerFactory;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * One isolated R session: a private directory, a worker holding the session's R environment, and a
 * single thread through which all of the session's executions pass in order.
 */
public final class RSession {
    private static final Logger logger = LogManager.getLogger(RSession.class);

    static final Duration DESTROY_GRACE = Duration.ofSeconds(2);

    private final String id;
    private final Path directory;
    private final InterpreterWorker worker;
    private final ImageHarvester harvester;
    private final boolean supportImageOutput;
    private final ExecutorService executor;
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    private RSession(String id, Path directory, InterpreterWorker worker, boolean supportImageOutput) {
        this.id = id;
        this.directory = directory;
        this.worker = worker;
        this.harvester = new ImageHarvester(directory);
        this.supportImageOutput = supportImageOutput;
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("RSession-" + sanitize(id) + "-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Create the session directory and worker. Unless lazy start is configured the interpreter is
     * started here, so a broken R installation is reported to the creator.
     *
     * @throws SessionException if the directory or the interpreter cannot be set up; nothing is
     *     left behind in that case
     */
    @Blocking
    public static RSession open(String id, PlaygroundConfig config, WorkerFactory workerFactory)
            throws SessionException {
        Path directory;
        try {
            Files.createDirectories(config.tempRoot());
            directory = Files.createTempDirectory(config.tempRoot(), "r_session_" + sanitize(id) + "_");
        } catch (IOException e) {
            throw new SessionException("Failed to create directory for session " + id, e);
        }

        var worker = workerFactory.create(id, directory);
        var session = new RSession(id, directory, worker, config.supportImageOutput());
        if (!config.lazyWorkerStart()) {
            try {
                worker.initialize();
            } catch (WorkerException e) {
                session.destroy();
                throw new SessionException("Failed to start R worker for session " + id + ": " + e.getMessage(), e);
            }
        }
        logger.info("Opened session {} in {}", id, directory);
        return session;
    }

    public String id() {
        return id;
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return false once the session was destroyed or its interpreter died
     */
    public boolean isAlive() {
        return !destroyed.get() && worker.isAlive();
    }

    @Blocking
    public ExecutionResult execute(String code) {
        return execute(code, null);
    }

    /**
     * Run code in this session and wait for the outcome.
     *
     * @param timeout maximum wait, or null to wait indefinitely; on expiry the interpreter is killed
     *     and the session becomes unusable
     */
    @Blocking
    public ExecutionResult execute(String code, @Nullable Duration timeout) {
        if (destroyed.get()) {
            return ExecutionResult.hostError("Session " + id + " has been destroyed");
        }

        Future<ExecutionResult> future;
        try {
            future = executor.submit(() -> runOnWorker(code));
        } catch (RejectedExecutionException e) {
            return ExecutionResult.hostError("Session " + id + " has been destroyed");
        }

        try {
            return timeout == null ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Execution in session {} exceeded {}; terminating its interpreter", id, timeout);
            future.cancel(true);
            worker.terminate();
            return ExecutionResult.hostError("Execution in session " + id + " timed out after " + timeout);
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            logger.error("Unexpected failure executing in session {}", id, cause);
            return ExecutionResult.hostError("Unexpected failure executing in session " + id, cause);
        } catch (CancellationException e) {
            if (destroyed.get()) {
                return ExecutionResult.hostError("Session " + id + " was destroyed before the execution ran");
            }
            return ExecutionResult.hostError("Execution in session " + id + " was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExecutionResult.hostError("Interrupted while waiting for session " + id, e);
        }
    }

    private ExecutionResult runOnWorker(String code) {
        try {
            worker.initialize();
        } catch (WorkerException e) {
            logger.error("Failed to start R worker for session {}", id, e);
            return ExecutionResult.hostError("Failed to start R worker for session " + id, e);
        }

        RawResult raw;
        try {
            raw = worker.run(code);
        } catch (WorkerException e) {
            logger.error("R worker for session {} failed", id, e);
            discardImages();
            return ExecutionResult.hostError("R worker for session " + id + " failed", e);
        }

        if (raw.status() != RawResult.Status.OK) {
            discardImages();
            return raw.status() == RawResult.Status.PARSE_ERROR
                    ? ExecutionResult.parseError(raw.error())
                    : ExecutionResult.interpreterError(raw.error());
        }

        List<PlotImage> images;
        try {
            images = harvester.harvest(supportImageOutput);
        } catch (IOException e) {
            logger.error("Failed to collect plots for session {}", id, e);
            return ExecutionResult.hostError("Failed to collect plots for session " + id, e);
        }
        return ExecutionResult.success(OutputMerger.merge(raw.console(), raw.value()), images);
    }

    private void discardImages() {
        try {
            harvester.harvest(false);
        } catch (IOException e) {
            logger.warn("Failed to clear plots for session {}: {}", id, e.getMessage());
        }
    }

    /**
     * Tear the session down: stop queued work, close the R environment, stop the interpreter and delete
     * the session directory. Each step runs even if an earlier one failed. Safe to call repeatedly.
     */
    @Blocking
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Destroying session {}", id);

        // queued executions never ran; cancel them so their callers return
        for (var pending : executor.shutdownNow()) {
            if (pending instanceof Future<?> future) {
                future.cancel(false);
            }
        }
        try {
            if (!executor.awaitTermination(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Session {} still busy after {}; terminating its interpreter", id, DESTROY_GRACE);
                worker.terminate();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.terminate();
        }

        try {
            worker.shutdown();
        } catch (RuntimeException e) {
            logger.warn("Error shutting down worker for session {}", id, e);
        }

        try {
            FileUtil.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Failed to delete directory {} of session {}", directory, id, e);
        }
    }

    static String sanitize(String id) {
        return id.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
