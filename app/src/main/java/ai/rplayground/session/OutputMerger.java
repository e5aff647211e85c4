package ai.rplayground.session;

/**
 * Combines what R printed to the console with the printed form of the last value.
 * The value is dropped when the console already shows it, which is the common case when the
 * guest code prints explicitly.
 */
public final class OutputMerger {
    private OutputMerger() {}

    public static String merge(String console, String value) {
        if (value.isBlank()) {
            return console;
        }
        if (console.isBlank()) {
            return value;
        }
        if (console.strip().contains(value.strip())) {
            return console;
        }
        return console + "\n" + value;
    }
}
