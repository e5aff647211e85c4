package ai.rplayground.session;

import java.time.Duration;
import java.util.Set;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Creates, drives and tears down isolated R sessions.
 *
 * <p>All methods are safe to call from any thread. Calls against the same session are executed one
 * at a time in submission order; calls against different sessions run in parallel.
 */
public interface SessionManager extends AutoCloseable {
    /**
     * Create a session. If a session with the same id already exists it is destroyed and replaced.
     *
     * @param sessionId requested id, or null to have one generated
     * @return the id of the new session
     * @throws SessionException if the session's interpreter could not be started
     */
    @Blocking
    String createSession(@Nullable String sessionId) throws SessionException;

    @Blocking
    default String createSession() throws SessionException {
        return createSession(null);
    }

    /**
     * Run code in a session using the configured default timeout. Never throws for interpreter or
     * host failures; those are reported through the returned result.
     *
     * @throws IllegalArgumentException if the session id or the code is null
     */
    @Blocking
    ExecutionResult executeInSession(String sessionId, String code);

    /**
     * Run code in a session, giving up after {@code timeout}. A session whose execution timed out is
     * killed and removed.
     *
     * @param timeout maximum wait, or null to wait indefinitely
     */
    @Blocking
    ExecutionResult executeInSession(String sessionId, String code, @Nullable Duration timeout);

    /**
     * @return true if a session with this id existed and has been destroyed
     */
    @Blocking
    boolean destroySession(String sessionId);

    /**
     * Destroy every session.
     */
    @Blocking
    void destroy();

    /**
     * Destroy every session and release resources shared between them.
     */
    @Override
    @Blocking
    void close();

    Set<String> sessionIds();

    int size();

    /**
     * Raised when a session cannot be constructed.
     */
    class SessionException extends Exception {
        public SessionException(String message) {
            super(message);
        }

        public SessionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
