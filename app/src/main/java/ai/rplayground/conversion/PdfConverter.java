package ai.rplayground.conversion;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Converts PDF documents to text and page images in a single long-lived worker process.
 */
public interface PdfConverter extends AutoCloseable {
    Duration DEFAULT_CONVERSION_TIMEOUT = Duration.ofSeconds(300);
    Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Launch the worker without waiting for it. Does nothing if it is already running.
     */
    void start() throws ConversionException;

    /**
     * Wait until the worker reports that it is ready.
     *
     * @param timeout maximum wait, or null to wait indefinitely
     * @return true once ready
     * @throws IllegalStateException if {@link #start()} was not called
     * @throws ConversionTimeoutException if the worker is not ready in time; the worker is shut down
     * @throws ConversionException if the worker failed to initialize; the worker is shut down
     */
    @Blocking
    boolean awaitStartup(@Nullable Duration timeout) throws ConversionException;

    /**
     * @throws IllegalStateException if the worker is not running
     * @throws java.nio.file.NoSuchFileException if {@code pdf} does not exist
     * @throws ConversionTimeoutException if the conversion takes longer than {@code timeout}
     * @throws ConversionException if the worker reports an error
     */
    @Blocking
    ConversionResult convert(Path pdf, Duration timeout) throws ConversionException, IOException;

    @Blocking
    default ConversionResult convert(Path pdf) throws ConversionException, IOException {
        return convert(pdf, DEFAULT_CONVERSION_TIMEOUT);
    }

    /**
     * Same as {@link #convert(Path, Duration)} without blocking the caller. The future completes
     * exceptionally with the exception {@code convert} would have thrown.
     */
    CompletableFuture<ConversionResult> convertAsync(Path pdf, Duration timeout);

    /**
     * Stop the worker, killing it if it does not exit within {@code timeout}. Safe to call repeatedly.
     */
    @Blocking
    void shutdown(Duration timeout);

    boolean isRunning();

    @Override
    @Blocking
    default void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    class ConversionTimeoutException extends ConversionException {
        public ConversionTimeoutException(String message) {
            super(message);
        }
    }
}
