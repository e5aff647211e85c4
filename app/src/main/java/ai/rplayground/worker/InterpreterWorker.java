package ai.rplayground.worker;

import org.jetbrains.annotations.Blocking;

/**
 * Serialized access to one isolated R evaluation environment living in an out-of-process
 * interpreter. A worker is owned exclusively by one session.
 *
 * <p>Lifecycle: {@link #initialize()} once, any number of {@link #run(String)} calls, then
 * {@link #shutdown()}. A worker that has been shut down or terminated never comes back.
 */
public interface InterpreterWorker {
    /**
     * Start the interpreter (if this worker owns one) and create the session's environment.
     * Calling it again after success is a no-op and never spawns a second process.
     *
     * @throws NotInitializedException if the worker was already shut down
     * @throws WorkerException if the interpreter could not be started
     */
    @Blocking
    void initialize() throws WorkerException;

    /**
     * Evaluate code in the worker's environment and wait for the outcome.
     *
     * @param code R source, possibly several lines
     * @return the typed outcome; guest errors are values, not exceptions
     * @throws NotInitializedException if called before {@link #initialize()} or after shutdown
     * @throws WorkerException if the interpreter process failed or replied out of protocol
     */
    @Blocking
    RawResult run(String code) throws WorkerException;

    /**
     * Clear the environment, collect garbage in R and release the interpreter process.
     * The process is released even when the graceful steps fail; the first failure is rethrown.
     */
    @Blocking
    void shutdownOrThrow() throws WorkerException;

    /**
     * Same as {@link #shutdownOrThrow()}, but failures are logged instead of thrown.
     * Safe to call repeatedly.
     */
    @Blocking
    void shutdown();

    /**
     * Kill the interpreter immediately, even if a {@link #run(String)} call is in flight.
     * The in-flight call fails with a {@link WorkerException}.
     */
    void terminate();

    /**
     * @return false once the worker has been shut down, terminated, or its process has died
     */
    boolean isAlive();

    /**
     * Exception raised when the interpreter process cannot be started or misbehaves.
     */
    class WorkerException extends Exception {
        public WorkerException(String message) {
            super(message);
        }

        public WorkerException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a worker is used before {@link #initialize()} succeeded or after it was shut down.
     */
    final class NotInitializedException extends WorkerException {
        public NotInitializedException(String message) {
            super(message);
        }
    }
}
