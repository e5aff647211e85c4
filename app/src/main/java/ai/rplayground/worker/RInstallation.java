package ai.rplayground.worker;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.worker.InterpreterWorker.WorkerException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Launches {@code Rscript} with the bundled worker bootstrap script.
 * When no R home is configured, {@code Rscript} is looked up on the PATH.
 */
public final class RInstallation implements InterpreterLauncher {
    private static final Logger logger = LogManager.getLogger(RInstallation.class);

    static final String BOOTSTRAP_RESOURCE = "rworker.R";
    private static final List<String> RSCRIPT_NAMES = List.of("Rscript", "Rscript.exe");

    @Nullable
    private final Path rHome;

    public RInstallation(@Nullable Path rHome) {
        this.rHome = rHome;
    }

    public static RInstallation fromConfig(PlaygroundConfig config) {
        return new RInstallation(config.rHome());
    }

    @Nullable
    public Path rHome() {
        return rHome;
    }

    /**
     * Resolve the Rscript executable. Only consulted when a worker process is about to start.
     */
    public String rscript() throws WorkerException {
        if (rHome == null) {
            return "Rscript";
        }
        if (!Files.isDirectory(rHome)) {
            throw new WorkerException("R home " + rHome + " does not exist or is not a directory");
        }
        for (var name : RSCRIPT_NAMES) {
            var candidate = rHome.resolve("bin").resolve(name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate.toString();
            }
        }
        throw new WorkerException("No executable Rscript found under " + rHome.resolve("bin"));
    }

    @Override
    public List<String> command(Path exchangeDir) throws WorkerException {
        var rscript = rscript();
        var script = exchangeDir.resolve(BOOTSTRAP_RESOURCE);
        try (var in = RInstallation.class.getResourceAsStream(BOOTSTRAP_RESOURCE)) {
            if (in == null) {
                throw new WorkerException("Bootstrap script " + BOOTSTRAP_RESOURCE + " missing from classpath");
            }
            Files.copy(in, script, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new WorkerException("Failed to stage R bootstrap script in " + exchangeDir, e);
        }
        logger.debug("Using {} with bootstrap {}", rscript, script);
        return List.of(rscript, "--vanilla", script.toString());
    }
}
