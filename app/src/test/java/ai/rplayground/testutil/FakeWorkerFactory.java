package ai.rplayground.testutil;

import ai.rplayground.worker.InterpreterWorker;
import ai.rplayground.worker.WorkerFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands out {@link FakeInterpreterWorker}s and remembers them.
 */
public final class FakeWorkerFactory implements WorkerFactory {
    private final List<FakeInterpreterWorker> created = new CopyOnWriteArrayList<>();
    private final Set<String> failingSessions = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * Make workers created for this session id fail to initialize.
     */
    public void failInitializationFor(String sessionId) {
        failingSessions.add(sessionId);
    }

    @Override
    public InterpreterWorker create(String sessionId, Path plotDir) {
        var worker = new FakeInterpreterWorker(sessionId, plotDir, failingSessions.contains(sessionId));
        created.add(worker);
        return worker;
    }

    public List<FakeInterpreterWorker> created() {
        return List.copyOf(created);
    }

    public List<FakeInterpreterWorker> createdFor(String sessionId) {
        return created.stream().filter(w -> w.sessionId().equals(sessionId)).toList();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
