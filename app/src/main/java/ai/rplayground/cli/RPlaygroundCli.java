package ai.rplayground.cli;

import ai.rplayground.config.PlaygroundConfig;
import ai.rplayground.conversion.PdfConverter;
import ai.rplayground.conversion.ProcessPdfConverter;
import ai.rplayground.session.ExecutionResult;
import ai.rplayground.session.RSessionManager;
import ai.rplayground.session.SessionManager;
import ai.rplayground.session.SessionManager.SessionException;
import ai.rplayground.worker.WorkerStrategy;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "rplayground",
        mixinStandardHelpOptions = true,
        description = "Run R code in an isolated session, or convert a PDF to text.",
        subcommands = {RPlaygroundCli.ExecCommand.class, RPlaygroundCli.ConvertPdfCommand.class})
public final class RPlaygroundCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(RPlaygroundCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INTERPRETER_ERROR = 1;
    static final int EXIT_HOST_ERROR = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");

        int exitCode = commandLine(RSessionManager::fromConfig, ProcessPdfConverter::new).execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command tree with the given collaborators, so callers can substitute them.
     */
    static CommandLine commandLine(
            Function<PlaygroundConfig, SessionManager> managerFactory, Supplier<PdfConverter> converterFactory) {
        var factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ExecCommand.class) {
                    return cls.cast(new ExecCommand(managerFactory));
                }
                if (cls == ConvertPdfCommand.class) {
                    return cls.cast(new ConvertPdfCommand(converterFactory));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        return new CommandLine(new RPlaygroundCli(), factory);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_HOST_ERROR;
    }

    @CommandLine.Command(
            name = "exec",
            mixinStandardHelpOptions = true,
            description = "Create a session, run the given R code in it, print the result and destroy the session.")
    static final class ExecCommand implements Callable<Integer> {
        private final Function<PlaygroundConfig, SessionManager> managerFactory;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(arity = "0..*", paramLabel = "CODE", description = "R code; each argument is one line.")
        List<String> code = List.of();

        @Nullable
        @CommandLine.Option(names = "--file", description = "Read the R code from this file instead.")
        Path file;

        @Nullable
        @CommandLine.Option(names = "--session", description = "Session id to use (generated if omitted).")
        String sessionId;

        @Nullable
        @CommandLine.Option(names = "--r-home", description = "R installation root (defaults to Rscript on the PATH).")
        Path rHome;

        @Nullable
        @CommandLine.Option(names = "--strategy", description = "Worker strategy: subprocess or shared.")
        String strategy;

        @Nullable
        @CommandLine.Option(names = "--timeout", description = "Execution timeout in seconds.")
        Long timeoutSeconds;

        @Nullable
        @CommandLine.Option(names = "--image-dir", description = "Directory to write plots into.")
        Path imageDir;

        ExecCommand(Function<PlaygroundConfig, SessionManager> managerFactory) {
            this.managerFactory = managerFactory;
        }

        @Override
        @Blocking
        public Integer call() throws IOException {
            var out = spec.commandLine().getOut();
            var err = spec.commandLine().getErr();

            String source;
            if (file != null) {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } else if (!code.isEmpty()) {
                source = String.join("\n", code);
            } else {
                err.println("Error: provide R code as arguments or with --file.");
                return EXIT_HOST_ERROR;
            }

            PlaygroundConfig config;
            try {
                config = PlaygroundConfig.load();
                if (rHome != null) {
                    config = config.withRHome(rHome);
                }
                if (strategy != null) {
                    config = config.withWorkerStrategy(WorkerStrategy.parse(strategy));
                }
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_HOST_ERROR;
            }
            var timeout = timeoutSeconds == null ? config.executeTimeout() : Duration.ofSeconds(timeoutSeconds);

            try (var manager = managerFactory.apply(config)) {
                String id;
                try {
                    id = manager.createSession(sessionId);
                } catch (SessionException e) {
                    logger.error("Session creation failed", e);
                    err.println("Error: " + e.getMessage());
                    return EXIT_HOST_ERROR;
                }
                logger.info("Created session {}", id);

                var result = manager.executeInSession(id, source, timeout);
                manager.destroySession(id);
                return report(result, out, err);
            }
        }

        private int report(ExecutionResult result, PrintWriter out, PrintWriter err)
                throws IOException {
            if (result.isSuccess()) {
                out.println(result.successfulOutput());
                if (imageDir != null && !result.images().isEmpty()) {
                    Files.createDirectories(imageDir);
                    for (var image : result.images()) {
                        var target = imageDir.resolve(image.fileName());
                        Files.write(target, image.bytes());
                        out.println("Saved " + image.width() + "x" + image.height() + " plot to " + target);
                    }
                } else if (!result.images().isEmpty()) {
                    out.println("(" + result.images().size() + " plot(s) produced; use --image-dir to save them)");
                }
                out.flush();
                return EXIT_OK;
            }
            if (result.isInterpreterError()) {
                err.println(result.interpreterErrorOutput());
                err.flush();
                return EXIT_INTERPRETER_ERROR;
            }
            err.println(result.hostErrorOutput());
            err.flush();
            return EXIT_HOST_ERROR;
        }
    }

    @CommandLine.Command(
            name = "convert-pdf",
            mixinStandardHelpOptions = true,
            description = "Extract the text (and page images) of a PDF document.")
    static final class ConvertPdfCommand implements Callable<Integer> {
        private final Supplier<PdfConverter> converterFactory;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", paramLabel = "PDF", description = "The PDF file to convert.")
        Path pdf;

        @CommandLine.Option(names = "--timeout", description = "Conversion timeout in seconds (default: ${DEFAULT-VALUE}).")
        long timeoutSeconds = PdfConverter.DEFAULT_CONVERSION_TIMEOUT.toSeconds();

        @Nullable
        @CommandLine.Option(names = "--image-dir", description = "Directory to write page images into.")
        Path imageDir;

        ConvertPdfCommand(Supplier<PdfConverter> converterFactory) {
            this.converterFactory = converterFactory;
        }

        @Override
        @Blocking
        public Integer call() throws IOException {
            var out = spec.commandLine().getOut();
            var err = spec.commandLine().getErr();

            if (!Files.isRegularFile(pdf)) {
                err.println("Error: no such file: " + pdf);
                return EXIT_HOST_ERROR;
            }

            try (var converter = converterFactory.get()) {
                converter.start();
                converter.awaitStartup(null);
                var result = converter.convert(pdf, Duration.ofSeconds(timeoutSeconds));
                out.println(result.text());
                if (imageDir != null) {
                    Files.createDirectories(imageDir);
                    for (var entry : result.images().entrySet()) {
                        var target = imageDir.resolve("page_" + entry.getKey() + ".png");
                        Files.write(target, Base64.getDecoder().decode(entry.getValue()));
                        out.println("Saved image of page " + entry.getKey() + " to " + target);
                    }
                }
                out.flush();
                return EXIT_OK;
            } catch (PdfConverter.ConversionException e) {
                logger.error("Conversion of {} failed", pdf, e);
                err.println("Error: " + e.getMessage());
                err.flush();
                return EXIT_HOST_ERROR;
            }
        }
    }
}
