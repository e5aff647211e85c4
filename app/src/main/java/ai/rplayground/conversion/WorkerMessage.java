package ai.rplayground.conversion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One JSON line written by the conversion worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record WorkerMessage(
        String type,
        @Nullable Long id,
        @Nullable String text,
        @Nullable Map<Integer, String> images,
        @Nullable String error) {

    static final String READY = "ready";
    static final String INIT_FAILED = "init_failed";
    static final String RESULT = "result";
    static final String ERROR = "error";

    static WorkerMessage ready() {
        return new WorkerMessage(READY, null, null, null, null);
    }

    static WorkerMessage initFailed(String error) {
        return new WorkerMessage(INIT_FAILED, null, null, null, error);
    }

    static WorkerMessage result(long id, String text, Map<Integer, String> images) {
        return new WorkerMessage(RESULT, id, text, images, null);
    }

    static WorkerMessage error(long id, String error) {
        return new WorkerMessage(ERROR, id, null, null, error);
    }
}
