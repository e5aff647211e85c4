package ai.rplayground.worker;

/**
 * Outcome of a single evaluation as reported by the interpreter.
 *
 * @param status how the evaluation ended
 * @param console text the code printed to the console, including warnings and messages
 * @param value printed form of the visible value of the last expression, or empty
 * @param error the R error message for {@link Status#RUNTIME_ERROR} and {@link Status#PARSE_ERROR}
 */
public record RawResult(Status status, String console, String value, String error) {
    public enum Status {
        OK,
        RUNTIME_ERROR,
        PARSE_ERROR
    }

    public RawResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        console = console == null ? "" : console;
        value = value == null ? "" : value;
        error = error == null ? "" : error;
    }

    public static RawResult success(String console, String value) {
        return new RawResult(Status.OK, console, value, "");
    }

    public static RawResult runtimeError(String console, String error) {
        return new RawResult(Status.RUNTIME_ERROR, console, "", error);
    }

    public static RawResult parseError(String error) {
        return new RawResult(Status.PARSE_ERROR, "", "", error);
    }
}
