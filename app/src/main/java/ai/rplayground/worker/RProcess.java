package ai.rplayground.worker;

import static java.nio.charset.StandardCharsets.UTF_8;

import ai.rplayground.util.FileUtil;
import ai.rplayground.worker.InterpreterWorker.WorkerException;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * One interpreter child process and the line protocol spoken with it.
 *
 * <p>Requests are written to the child's stdin; each is answered by a single {@code <nonce> <STATUS>}
 * line on stdout. Any other stdout line is stray guest output and is only logged. Larger payloads
 * (console text, printed value, error message) are exchanged through files in a private exchange
 * directory that this object creates and deletes.
 *
 * <p>Request/reply round trips are serialized by a lock. {@link #terminate()} does not take the lock,
 * so it can kill a process whose evaluation never returns.
 */
public final class RProcess implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RProcess.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

    private static final String CONSOLE_PAYLOAD = "console.txt";
    private static final String VALUE_PAYLOAD = "value.txt";
    private static final String ERROR_PAYLOAD = "error.txt";

    private static final Duration QUIT_GRACE = Duration.ofSeconds(1);
    private static final int SHUTDOWN_WAIT_SECONDS = 5;

    private final String name;
    private final String nonce;
    private final Path exchangeDir;
    private final Process process;
    private final BufferedReader replies;
    private final BufferedWriter requests;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private RProcess(String name, String nonce, Path exchangeDir, Process process) {
        this.name = name;
        this.nonce = nonce;
        this.exchangeDir = exchangeDir;
        this.process = process;
        this.replies = new BufferedReader(new InputStreamReader(process.getInputStream(), UTF_8));
        this.requests = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), UTF_8));
    }

    /**
     * Start an interpreter and wait until it reports readiness.
     *
     * @param name label used for logging and thread names
     * @param launcher supplies the interpreter command line
     * @param tempRoot directory under which the exchange directory is created
     * @param startupTimeout how long to wait for the readiness line
     * @return a ready process
     * @throws WorkerException if the process cannot be started or does not become ready in time
     */
    @Blocking
    public static RProcess start(String name, InterpreterLauncher launcher, Path tempRoot, Duration startupTimeout)
            throws WorkerException {
        Path exchangeDir;
        try {
            Files.createDirectories(tempRoot);
            exchangeDir = Files.createTempDirectory(tempRoot, "rworker-");
        } catch (IOException e) {
            throw new WorkerException("Failed to create exchange directory under " + tempRoot, e);
        }

        var nonce = generateNonce();
        List<String> command;
        Process process;
        try {
            command = new ArrayList<>(launcher.command(exchangeDir));
            command.add(nonce);
            command.add(exchangeDir.toString());

            var processBuilder = new ProcessBuilder(command);
            processBuilder.directory(exchangeDir.toFile());
            process = processBuilder.start();
        } catch (WorkerException e) {
            deleteExchangeDir(exchangeDir);
            throw e;
        } catch (IOException e) {
            deleteExchangeDir(exchangeDir);
            throw new WorkerException("Failed to start interpreter process for " + name, e);
        }

        logger.info("Started interpreter process for {} (pid={})", name, process.pid());
        consumeErrorStream(process, name);

        var rProcess = new RProcess(name, nonce, exchangeDir, process);
        rProcess.awaitReady(startupTimeout);
        return rProcess;
    }

    private static String generateNonce() {
        var bytes = new byte[12];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static void consumeErrorStream(Process process, String name) {
        var errorReader = new Thread(
                () -> {
                    try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), UTF_8))) {
                        reader.lines().forEach(line -> logger.info("[rworker:{}] {}", name, line));
                    } catch (IOException e) {
                        logger.debug("Stopped reading stderr of interpreter {}: {}", name, e.getMessage());
                    }
                },
                "RWorkerStderr-" + name);
        errorReader.setDaemon(true);
        errorReader.start();
    }

    private void awaitReady(Duration startupTimeout) throws WorkerException {
        var ready = new CompletableFuture<String>();
        var waiter = new Thread(
                () -> {
                    try {
                        ready.complete(readStatus());
                    } catch (Throwable t) {
                        ready.completeExceptionally(t);
                    }
                },
                "RWorkerStartup-" + name);
        waiter.setDaemon(true);
        waiter.start();

        String status;
        try {
            status = ready.get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon();
            throw new WorkerException("Interpreter " + name + " did not become ready within " + startupTimeout);
        } catch (ExecutionException e) {
            abandon();
            throw new WorkerException("Interpreter " + name + " failed during startup", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon();
            throw new WorkerException("Interrupted while waiting for interpreter " + name + " to start", e);
        }

        if (!"READY".equals(status)) {
            abandon();
            throw new WorkerException("Unexpected startup reply from interpreter " + name + ": " + status);
        }
        logger.debug("Interpreter {} is ready", name);
    }

    public String name() {
        return name;
    }

    public boolean isAlive() {
        return !closed.get() && !terminated.get() && process.isAlive();
    }

    /**
     * Create a fresh environment (parent: the global environment) with the image path helper bound in it.
     */
    @Blocking
    public void openEnvironment(String environment, Path plotDir) throws WorkerException {
        lock.lock();
        try {
            ensureUsable();
            send(List.of("OPEN " + environment, plotDir.toAbsolutePath().toString().replace('\\', '/')));
            expectOk("OPEN " + environment);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluate code in the named environment.
     */
    @Blocking
    public RawResult evaluate(String environment, String code) throws WorkerException {
        lock.lock();
        try {
            ensureUsable();
            clearPayloads();

            var lines = code.isEmpty() ? List.<String>of() : LINE_SPLITTER.splitToList(code);
            var request = new ArrayList<String>(lines.size() + 1);
            request.add("EVAL " + environment + " " + lines.size());
            request.addAll(lines);
            send(request);

            var status = readStatus();
            return switch (status) {
                case "OK" -> RawResult.success(readPayload(CONSOLE_PAYLOAD), readPayload(VALUE_PAYLOAD));
                case "ERROR" -> RawResult.runtimeError(readPayload(CONSOLE_PAYLOAD), readPayload(ERROR_PAYLOAD));
                case "PARSE_ERROR" -> RawResult.parseError(readPayload(ERROR_PAYLOAD));
                case "FAULT" -> throw new WorkerException(
                        "Interpreter " + name + " reported an internal fault: " + readPayload(ERROR_PAYLOAD));
                default -> throw new WorkerException("Unexpected reply from interpreter " + name + ": " + status);
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every binding in the environment, drop it, and run the R garbage collector.
     *
     * @param grace how long to wait for an in-flight evaluation to finish before giving up
     */
    @Blocking
    public void closeEnvironment(String environment, Duration grace) throws WorkerException {
        acquire(grace, "CLOSE " + environment);
        try {
            ensureUsable();
            send(List.of("CLOSE " + environment));
            expectOk("CLOSE " + environment);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Kill the process without waiting for the current request. Does not take the request lock.
     */
    public void terminate() {
        if (terminated.compareAndSet(false, true)) {
            logger.warn("Terminating interpreter process for {} (pid={})", name, process.pid());
            process.destroyForcibly();
        }
    }

    /**
     * Ask the interpreter to quit, then make sure the process is gone and the exchange directory deleted.
     * Safe to call more than once.
     */
    @Override
    @Blocking
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down interpreter process for {} (pid={})", name, process.pid());

        if (!terminated.get() && process.isAlive()) {
            requestQuit();
        }

        try {
            process.destroy();
            if (!process.waitFor(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Interpreter {} did not terminate gracefully, forcing kill", name);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for interpreter {} to terminate", name, e);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }

        deleteExchangeDir(exchangeDir);
    }

    private void abandon() {
        terminate();
        close();
    }

    private void requestQuit() {
        boolean locked = false;
        try {
            locked = lock.tryLock(QUIT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            if (!locked) {
                logger.warn("Interpreter {} is busy; skipping graceful quit", name);
                return;
            }
            send(List.of("QUIT"));
            var status = readStatus();
            if (!"BYE".equals(status)) {
                logger.warn("Unexpected reply to QUIT from interpreter {}: {}", name, status);
            }
        } catch (WorkerException e) {
            logger.warn("Graceful quit of interpreter {} failed: {}", name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (locked) {
                lock.unlock();
            }
        }
    }

    private void acquire(Duration grace, String request) throws WorkerException {
        try {
            if (!lock.tryLock(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new WorkerException(
                        "Interpreter " + name + " still busy after " + grace + "; could not send " + request);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while waiting to send " + request + " to " + name, e);
        }
    }

    private void ensureUsable() throws WorkerException {
        if (closed.get() || terminated.get()) {
            throw new WorkerException("Interpreter " + name + " has been shut down");
        }
        if (!process.isAlive()) {
            throw new WorkerException("Interpreter " + name + " is no longer running" + describeExit());
        }
    }

    private void send(List<String> lines) throws WorkerException {
        try {
            for (var line : lines) {
                requests.write(line);
                requests.write('\n');
            }
            requests.flush();
        } catch (IOException e) {
            throw new WorkerException("Failed to send request to interpreter " + name + describeExit(), e);
        }
    }

    private void expectOk(String request) throws WorkerException {
        var status = readStatus();
        if ("FAULT".equals(status)) {
            throw new WorkerException(request + " failed in interpreter " + name + ": " + readPayload(ERROR_PAYLOAD));
        }
        if (!"OK".equals(status)) {
            throw new WorkerException("Unexpected reply to " + request + " from interpreter " + name + ": " + status);
        }
    }

    private String readStatus() throws WorkerException {
        var prefix = nonce + " ";
        try {
            String line;
            while ((line = replies.readLine()) != null) {
                if (line.startsWith(prefix)) {
                    return line.substring(prefix.length()).strip();
                }
                logger.debug("[rworker:{}] stray output: {}", name, line);
            }
        } catch (IOException e) {
            throw new WorkerException("Failed to read reply from interpreter " + name + describeExit(), e);
        }
        throw new WorkerException("Interpreter process " + name + " exited unexpectedly" + describeExit());
    }

    private String readPayload(String fileName) throws WorkerException {
        var path = exchangeDir.resolve(fileName);
        try {
            if (!Files.exists(path)) {
                return "";
            }
            var text = Files.readString(path, UTF_8);
            return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        } catch (IOException e) {
            throw new WorkerException("Failed to read " + fileName + " from interpreter " + name, e);
        }
    }

    private void clearPayloads() throws WorkerException {
        try {
            for (var fileName : List.of(CONSOLE_PAYLOAD, VALUE_PAYLOAD, ERROR_PAYLOAD)) {
                Files.deleteIfExists(exchangeDir.resolve(fileName));
            }
        } catch (IOException e) {
            throw new WorkerException("Failed to reset exchange directory " + exchangeDir, e);
        }
    }

    private String describeExit() {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) {
                return " (exit code " + process.exitValue() + ")";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }

    private static void deleteExchangeDir(@Nullable Path exchangeDir) {
        if (exchangeDir == null) {
            return;
        }
        try {
            FileUtil.deleteRecursively(exchangeDir);
        } catch (IOException e) {
            logger.warn("Failed to delete exchange directory {}", exchangeDir, e);
        }
    }
}
