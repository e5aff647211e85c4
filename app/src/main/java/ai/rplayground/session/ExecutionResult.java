package ai.rplayground.session;

import com.google.common.base.Throwables;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one execution. Exactly one of the three outputs is non-null:
 *
 * <ul>
 *   <li>{@code successfulOutput}: console text merged with the printed value
 *   <li>{@code interpreterErrorOutput}: an R runtime or parse error raised by the guest code
 *   <li>{@code hostErrorOutput}: a failure of the orchestration layer itself
 * </ul>
 *
 * Images are only ever attached to a successful result.
 */
public record ExecutionResult(
        @Nullable String successfulOutput,
        @Nullable String interpreterErrorOutput,
        @Nullable String hostErrorOutput,
        List<PlotImage> images) {

    public static final String PARSE_ERROR_PREFIX = "R parsing error: ";

    public ExecutionResult {
        int populated = (successfulOutput != null ? 1 : 0)
                + (interpreterErrorOutput != null ? 1 : 0)
                + (hostErrorOutput != null ? 1 : 0);
        if (populated != 1) {
            throw new IllegalArgumentException("Exactly one output must be set, found " + populated);
        }
        images = images == null ? List.of() : List.copyOf(images);
        if (!images.isEmpty() && successfulOutput == null) {
            throw new IllegalArgumentException("Images can only accompany a successful result");
        }
    }

    public static ExecutionResult success(String output) {
        return new ExecutionResult(output, null, null, List.of());
    }

    public static ExecutionResult success(String output, List<PlotImage> images) {
        return new ExecutionResult(output, null, null, images);
    }

    public static ExecutionResult interpreterError(String message) {
        return new ExecutionResult(null, message, null, List.of());
    }

    public static ExecutionResult parseError(String message) {
        return interpreterError(PARSE_ERROR_PREFIX + message);
    }

    public static ExecutionResult hostError(String message) {
        return new ExecutionResult(null, null, message, List.of());
    }

    /**
     * Host error carrying the full stack trace of the failure as diagnostic text.
     */
    public static ExecutionResult hostError(String message, Throwable cause) {
        return hostError(message + "\n" + Throwables.getStackTraceAsString(cause));
    }

    public boolean isSuccess() {
        return successfulOutput != null;
    }

    public boolean isInterpreterError() {
        return interpreterErrorOutput != null;
    }

    public boolean isHostError() {
        return hostErrorOutput != null;
    }
}
