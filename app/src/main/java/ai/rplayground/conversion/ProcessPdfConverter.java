package ai.rplayground.conversion;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * {@link PdfConverter} backed by one child JVM running {@link PdfConversionWorkerMain}.
 *
 * <p>Requests carry an id; a reader thread matches each reply to the waiting caller. A timeout or
 * worker error shuts the whole worker down, after which {@link #start()} launches a fresh one.
 */
public final class ProcessPdfConverter implements PdfConverter {
    private static final Logger logger = LogManager.getLogger(ProcessPdfConverter.class);
    private static final Duration FAILURE_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    private final ObjectMapper objectMapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final String classpath;
    private final List<String> jvmOptions;
    private final AtomicLong requestIds = new AtomicLong();
    private final ExecutorService asyncExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("PdfConvert-%d")
            .setDaemon(true)
            .build());

    @Nullable
    private volatile Worker worker;

    public ProcessPdfConverter() {
        this(requireNonNull(System.getProperty("java.class.path"), "java.class.path system property is null"), List.of());
    }

    /**
     * @param classpath classpath of the worker JVM; must contain this module and PDFBox
     * @param jvmOptions extra options for the worker JVM, e.g. a heap limit
     */
    public ProcessPdfConverter(String classpath, List<String> jvmOptions) {
        this.classpath = classpath;
        this.jvmOptions = List.copyOf(jvmOptions);
    }

    /** State of one launched worker process. */
    private static final class Worker {
        final Process process;
        final BufferedWriter requests;
        final CompletableFuture<Void> ready = new CompletableFuture<>();
        final Map<Long, CompletableFuture<ConversionResult>> pending = new ConcurrentHashMap<>();

        Worker(Process process) {
            this.process = process;
            this.requests = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), UTF_8));
        }

        void failAll(String message) {
            ready.completeExceptionally(new ConversionException(message));
            for (var id : List.copyOf(pending.keySet())) {
                var future = pending.remove(id);
                if (future != null) {
                    future.completeExceptionally(new ConversionException(message));
                }
            }
        }
    }

    @Override
    public synchronized void start() throws ConversionException {
        if (worker != null) {
            return;
        }

        var javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        var command = new ArrayList<String>();
        command.add(javaBin);
        command.addAll(jvmOptions);
        command.add("-Djava.awt.headless=true");
        command.add("-cp");
        command.add(classpath);
        command.add(PdfConversionWorkerMain.class.getName());

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ConversionException("Failed to start PDF conversion worker", e);
        }
        logger.info("Started PDF conversion worker (pid={})", process.pid());

        var started = new Worker(process);
        worker = started;
        startDaemon("PdfWorkerStdout-" + process.pid(), () -> readReplies(started));
        startDaemon("PdfWorkerStderr-" + process.pid(), () -> drainErrors(started));
    }

    private static void startDaemon(String name, Runnable body) {
        var thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
    }

    private void readReplies(Worker target) {
        try (var reader = new BufferedReader(new InputStreamReader(target.process.getInputStream(), UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                dispatch(target, line);
            }
        } catch (IOException e) {
            logger.debug("Stopped reading PDF worker output: {}", e.getMessage());
        }
        target.failAll("PDF conversion worker exited");
    }

    private void dispatch(Worker target, String line) {
        WorkerMessage message;
        try {
            message = objectMapper.readValue(line, WorkerMessage.class);
        } catch (IOException e) {
            logger.warn("Unparseable line from PDF worker: {}", line);
            return;
        }
        if (message.type() == null) {
            logger.warn("PDF worker message without a type: {}", line);
            return;
        }

        switch (message.type()) {
            case WorkerMessage.READY -> target.ready.complete(null);
            case WorkerMessage.INIT_FAILED -> target.ready.completeExceptionally(
                    new ConversionException("PDF conversion worker failed to initialize: " + message.error()));
            case WorkerMessage.RESULT, WorkerMessage.ERROR -> {
                var future = message.id() == null ? null : target.pending.remove(message.id());
                if (future == null) {
                    logger.warn("Reply for unknown PDF request {}", message.id());
                    return;
                }
                if (WorkerMessage.ERROR.equals(message.type())) {
                    future.completeExceptionally(new ConversionException("PDF conversion failed: " + message.error()));
                } else if (message.text() == null) {
                    future.completeExceptionally(new ConversionException("Malformed conversion result: missing text"));
                } else {
                    future.complete(new ConversionResult(message.text(), message.images()));
                }
            }
            default -> logger.warn("Unknown message type from PDF worker: {}", message.type());
        }
    }

    private static void drainErrors(Worker target) {
        try (var reader = new BufferedReader(new InputStreamReader(target.process.getErrorStream(), UTF_8))) {
            reader.lines().forEach(line -> logger.debug("[pdf-worker] {}", line));
        } catch (IOException e) {
            logger.debug("Stopped reading PDF worker stderr: {}", e.getMessage());
        }
    }

    @Override
    public boolean awaitStartup(@Nullable Duration timeout) throws ConversionException {
        var current = worker;
        if (current == null) {
            throw new IllegalStateException("PDF converter has not been started");
        }
        try {
            if (timeout == null) {
                current.ready.get();
            } else {
                current.ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return true;
        } catch (TimeoutException e) {
            shutdown(FAILURE_SHUTDOWN_TIMEOUT);
            throw new ConversionTimeoutException("PDF conversion worker did not start within " + timeout);
        } catch (ExecutionException e) {
            shutdown(FAILURE_SHUTDOWN_TIMEOUT);
            throw asConversionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while waiting for PDF conversion worker", e);
        }
    }

    @Override
    public ConversionResult convert(Path pdf, Duration timeout) throws ConversionException, IOException {
        var current = worker;
        if (current == null || !current.process.isAlive()) {
            throw new IllegalStateException("PDF converter is not running");
        }
        if (!Files.isRegularFile(pdf)) {
            throw new NoSuchFileException(pdf.toString(), null, "PDF file not found");
        }

        var id = requestIds.incrementAndGet();
        var future = new CompletableFuture<ConversionResult>();
        current.pending.put(id, future);
        try {
            var request = objectMapper.writeValueAsString(
                    ConversionRequest.convert(id, pdf.toAbsolutePath().toString()));
            synchronized (current.requests) {
                current.requests.write(request);
                current.requests.newLine();
                current.requests.flush();
            }
        } catch (IOException e) {
            current.pending.remove(id);
            shutdown(FAILURE_SHUTDOWN_TIMEOUT);
            throw new ConversionException("Failed to send request to PDF conversion worker", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            current.pending.remove(id);
            shutdown(FAILURE_SHUTDOWN_TIMEOUT);
            throw new ConversionTimeoutException("Conversion of " + pdf + " timed out after " + timeout);
        } catch (ExecutionException e) {
            shutdown(FAILURE_SHUTDOWN_TIMEOUT);
            throw asConversionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.pending.remove(id);
            throw new ConversionException("Interrupted while converting " + pdf, e);
        }
    }

    @Override
    public CompletableFuture<ConversionResult> convertAsync(Path pdf, Duration timeout) {
        if (asyncExecutor.isShutdown()) {
            return CompletableFuture.failedFuture(new IllegalStateException("PDF converter has been closed"));
        }
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return convert(pdf, timeout);
                    } catch (ConversionException | IOException e) {
                        throw new CompletionException(e);
                    }
                },
                asyncExecutor);
    }

    @Override
    public void shutdown(Duration timeout) {
        Worker current;
        synchronized (this) {
            current = worker;
            worker = null;
        }
        if (current == null) {
            return;
        }

        logger.info("Shutting down PDF conversion worker (pid={})", current.process.pid());
        try {
            synchronized (current.requests) {
                current.requests.write(objectMapper.writeValueAsString(ConversionRequest.quit()));
                current.requests.newLine();
                current.requests.flush();
            }
        } catch (IOException e) {
            logger.debug("Could not send quit to PDF conversion worker: {}", e.getMessage());
        }

        try {
            if (!current.process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("PDF conversion worker did not exit within {}, forcing kill", timeout);
                current.process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.process.destroyForcibly();
        }
        current.failAll("PDF converter was shut down");
    }

    /**
     * Stop the worker and release the threads behind {@link #convertAsync}. Unlike
     * {@link #shutdown(Duration)}, the converter cannot be restarted afterwards.
     */
    @Override
    public void close() {
        try {
            shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
        } finally {
            asyncExecutor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        var current = worker;
        return current != null
                && current.process.isAlive()
                && current.ready.isDone()
                && !current.ready.isCompletedExceptionally();
    }

    private static ConversionException asConversionException(@Nullable Throwable cause) {
        if (cause instanceof ConversionException conversionException) {
            return conversionException;
        }
        return new ConversionException("PDF conversion worker failed", requireNonNull(cause));
    }
}
