package ai.rplayground.worker;

import java.util.Locale;

/**
 * How sessions are mapped onto interpreter processes.
 */
public enum WorkerStrategy {
    /** One interpreter process per session. */
    SUBPROCESS,
    /** One interpreter process per manager, one environment per session. Cheaper, weaker isolation. */
    SHARED;

    public static WorkerStrategy parse(String value) {
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown worker strategy '" + value + "', expected one of subprocess, shared", e);
        }
    }
}
