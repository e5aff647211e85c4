package ai.rplayground.session;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.worker.WorkerFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * {@link SessionManager} keeping its sessions in a concurrent map. There is no manager-wide lock:
 * each session serializes its own work.
 */
public final class RSessionManager implements SessionManager {
    private static final Logger logger = LogManager.getLogger(RSessionManager.class);

    private static final int ID_MIN = 10_000_000;
    private static final int ID_MAX = 99_999_999;

    private final PlaygroundConfig config;
    private final WorkerFactory workerFactory;
    private final ConcurrentHashMap<String, RSession> sessions = new ConcurrentHashMap<>();

    public RSessionManager(PlaygroundConfig config, WorkerFactory workerFactory) {
        this.config = config;
        this.workerFactory = workerFactory;
    }

    public static RSessionManager fromConfig(PlaygroundConfig config) {
        return new RSessionManager(config, WorkerFactory.forConfig(config));
    }

    @Override
    public String createSession(@Nullable String sessionId) throws SessionException {
        if (sessionId != null && sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        var id = sessionId == null ? generateId() : sessionId;

        var prior = sessions.remove(id);
        if (prior != null) {
            logger.info("Replacing existing session {}", id);
            prior.destroy();
        }

        var session = RSession.open(id, config, workerFactory);
        var displaced = sessions.put(id, session);
        if (displaced != null && displaced != session) {
            logger.info("Session {} was recreated concurrently; destroying the displaced instance", id);
            displaced.destroy();
        }
        logger.info("Created session {} ({} active)", id, sessions.size());
        return id;
    }

    private String generateId() {
        String id;
        do {
            id = "s" + ThreadLocalRandom.current().nextInt(ID_MIN, ID_MAX + 1);
        } while (sessions.containsKey(id));
        return id;
    }

    @Override
    public ExecutionResult executeInSession(String sessionId, String code) {
        return executeInSession(sessionId, code, config.executeTimeout());
    }

    @Override
    public ExecutionResult executeInSession(String sessionId, String code, @Nullable Duration timeout) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id must not be null");
        }
        if (code == null) {
            throw new IllegalArgumentException("Code must not be null");
        }
        var session = sessions.get(sessionId);
        if (session == null) {
            return ExecutionResult.hostError("Session " + sessionId + " does not exist");
        }

        var result = session.execute(code, timeout);
        if (!session.isAlive() && sessions.remove(sessionId, session)) {
            logger.warn("Interpreter of session {} is gone; removing the session", sessionId);
            session.destroy();
        }
        return result;
    }

    @Override
    public boolean destroySession(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id must not be null");
        }
        var session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        try {
            session.destroy();
        } catch (RuntimeException e) {
            logger.error("Error destroying session {}", sessionId, e);
        }
        return true;
    }

    @Override
    public void destroy() {
        var ids = new ArrayList<>(sessions.keySet());
        if (!ids.isEmpty()) {
            logger.info("Destroying {} sessions", ids.size());
        }
        for (var id : ids) {
            destroySession(id);
        }
    }

    @Override
    public void close() {
        destroy();
        try {
            workerFactory.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing worker factory", e);
        }
    }

    @Override
    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
