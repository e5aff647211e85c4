package ai.rplayground.config;

import ai.rplayground.worker.WorkerStrategy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runtime settings for the session manager and its workers.
 *
 * <p>Each key is looked up as a system property {@code rplayground.<key>} first, then as an
 * environment variable {@code RPLAYGROUND_<KEY>}; the R home additionally falls back to the
 * standard {@code R_HOME} variable.
 *
 * @param rHome R installation root, or null to use {@code Rscript} from the PATH
 * @param workerStrategy how sessions map onto interpreter processes
 * @param supportImageOutput whether plot files are decoded and returned
 * @param executeTimeout default bound for a single execution, or null to wait indefinitely
 * @param workerStartupTimeout how long an interpreter may take to report readiness
 * @param tempRoot where session and exchange directories are created
 * @param lazyWorkerStart defer starting a session's interpreter until its first execution
 */
public record PlaygroundConfig(
        @Nullable Path rHome,
        WorkerStrategy workerStrategy,
        boolean supportImageOutput,
        @Nullable Duration executeTimeout,
        Duration workerStartupTimeout,
        Path tempRoot,
        boolean lazyWorkerStart) {
    private static final Logger logger = LogManager.getLogger(PlaygroundConfig.class);

    public static final String ENV_PREFIX = "RPLAYGROUND_";
    public static final String PROPERTY_PREFIX = "rplayground.";

    static final String R_HOME = "R_HOME";
    static final String WORKER_STRATEGY = "WORKER_STRATEGY";
    static final String SUPPORT_IMAGE_OUTPUT = "SUPPORT_IMAGE_OUTPUT";
    static final String EXECUTE_TIMEOUT_SECONDS = "EXECUTE_TIMEOUT_SECONDS";
    static final String WORKER_STARTUP_TIMEOUT_SECONDS = "WORKER_STARTUP_TIMEOUT_SECONDS";
    static final String TEMP_ROOT = "TEMP_ROOT";
    static final String LAZY_WORKER_START = "LAZY_WORKER_START";

    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(60);

    public PlaygroundConfig {
        if (workerStrategy == null) {
            throw new IllegalArgumentException("workerStrategy must not be null");
        }
        if (workerStartupTimeout == null || workerStartupTimeout.isNegative() || workerStartupTimeout.isZero()) {
            throw new IllegalArgumentException("workerStartupTimeout must be positive");
        }
        if (executeTimeout != null && (executeTimeout.isNegative() || executeTimeout.isZero())) {
            throw new IllegalArgumentException("executeTimeout must be positive when set");
        }
        if (tempRoot == null) {
            throw new IllegalArgumentException("tempRoot must not be null");
        }
    }

    public static PlaygroundConfig defaults() {
        return new PlaygroundConfig(
                null,
                WorkerStrategy.SUBPROCESS,
                true,
                null,
                DEFAULT_STARTUP_TIMEOUT,
                Path.of(System.getProperty("java.io.tmpdir")),
                false);
    }

    /**
     * Resolve the configuration from system properties and the process environment.
     */
    public static PlaygroundConfig load() {
        var properties = new HashMap<String, String>();
        for (var name : System.getProperties().stringPropertyNames()) {
            properties.put(name, System.getProperty(name));
        }
        return fromSources(properties, System.getenv());
    }

    /**
     * Resolve the configuration from explicit property and environment maps.
     *
     * @throws IllegalArgumentException if a value is present but malformed
     */
    public static PlaygroundConfig fromSources(Map<String, String> properties, Map<String, String> environment) {
        var defaults = defaults();

        var rHomeValue = value(properties, environment, R_HOME);
        if (rHomeValue == null) {
            rHomeValue = blankToNull(environment.get(R_HOME));
        }

        var strategyValue = value(properties, environment, WORKER_STRATEGY);
        var imagesValue = value(properties, environment, SUPPORT_IMAGE_OUTPUT);
        var timeoutValue = value(properties, environment, EXECUTE_TIMEOUT_SECONDS);
        var startupValue = value(properties, environment, WORKER_STARTUP_TIMEOUT_SECONDS);
        var tempRootValue = value(properties, environment, TEMP_ROOT);
        var lazyValue = value(properties, environment, LAZY_WORKER_START);

        var config = new PlaygroundConfig(
                rHomeValue == null ? null : Path.of(rHomeValue),
                strategyValue == null ? defaults.workerStrategy() : WorkerStrategy.parse(strategyValue),
                imagesValue == null ? defaults.supportImageOutput() : parseBoolean(SUPPORT_IMAGE_OUTPUT, imagesValue),
                timeoutValue == null ? null : parseSeconds(EXECUTE_TIMEOUT_SECONDS, timeoutValue),
                startupValue == null
                        ? defaults.workerStartupTimeout()
                        : parseSeconds(WORKER_STARTUP_TIMEOUT_SECONDS, startupValue),
                tempRootValue == null ? defaults.tempRoot() : Path.of(tempRootValue),
                lazyValue == null ? defaults.lazyWorkerStart() : parseBoolean(LAZY_WORKER_START, lazyValue));
        logger.debug("Resolved configuration: {}", config);
        return config;
    }

    public PlaygroundConfig withRHome(@Nullable Path newRHome) {
        return new PlaygroundConfig(
                newRHome,
                workerStrategy,
                supportImageOutput,
                executeTimeout,
                workerStartupTimeout,
                tempRoot,
                lazyWorkerStart);
    }

    public PlaygroundConfig withWorkerStrategy(WorkerStrategy newStrategy) {
        return new PlaygroundConfig(
                rHome, newStrategy, supportImageOutput, executeTimeout, workerStartupTimeout, tempRoot, lazyWorkerStart);
    }

    public PlaygroundConfig withExecuteTimeout(@Nullable Duration newTimeout) {
        return new PlaygroundConfig(
                rHome, workerStrategy, supportImageOutput, newTimeout, workerStartupTimeout, tempRoot, lazyWorkerStart);
    }

    public PlaygroundConfig withTempRoot(Path newTempRoot) {
        return new PlaygroundConfig(
                rHome, workerStrategy, supportImageOutput, executeTimeout, workerStartupTimeout, newTempRoot, lazyWorkerStart);
    }

    public PlaygroundConfig withLazyWorkerStart(boolean lazy) {
        return new PlaygroundConfig(
                rHome, workerStrategy, supportImageOutput, executeTimeout, workerStartupTimeout, tempRoot, lazy);
    }

    public PlaygroundConfig withSupportImageOutput(boolean support) {
        return new PlaygroundConfig(
                rHome, workerStrategy, support, executeTimeout, workerStartupTimeout, tempRoot, lazyWorkerStart);
    }

    /**
     * Look up a key as a system property first, then as a prefixed environment variable.
     * Returns null only if both are absent or blank.
     */
    @Nullable
    private static String value(Map<String, String> properties, Map<String, String> environment, String key) {
        var propertyName = PROPERTY_PREFIX + key.toLowerCase(Locale.ROOT).replace('_', '.');
        var propertyValue = blankToNull(properties.get(propertyName));
        if (propertyValue != null) {
            return propertyValue;
        }
        return blankToNull(environment.get(ENV_PREFIX + key));
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        };
    }

    private static Duration parseSeconds(String key, String value) {
        try {
            var seconds = Double.parseDouble(value);
            if (seconds <= 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                throw new IllegalArgumentException("Invalid number of seconds for " + key + ": " + value);
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number of seconds for " + key + ": " + value, e);
        }
    }
}
