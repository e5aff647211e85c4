package ai.rplayground.testutil;

import static java.nio.charset.StandardCharsets.UTF_8;

import ai.rplayground.worker.RawResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Child process speaking the interpreter wire protocol on top of {@link MiniInterpreter}.
 *
 * <p>Usage: {@code [--no-ready] [--exit-on-start] <nonce> <exchange dir>}.
 */
public final class ScriptedInterpreterMain {
    private final String nonce;
    private final Path exchange;
    private final PrintStream out;
    private final Map<String, MiniInterpreter> environments = new HashMap<>();

    private ScriptedInterpreterMain(String nonce, Path exchange, PrintStream out) {
        this.nonce = nonce;
        this.exchange = exchange;
        this.out = out;
    }

    public static void main(String[] args) throws Exception {
        var flags = List.of(args).subList(0, args.length - 2);
        var nonce = args[args.length - 2];
        var exchange = Path.of(args[args.length - 1]);
        var out = new PrintStream(System.out, true, UTF_8);

        if (flags.contains("--exit-on-start")) {
            System.err.println("refusing to start");
            System.exit(7);
        }
        if (flags.contains("--no-ready")) {
            Thread.sleep(Long.MAX_VALUE);
        }
        new ScriptedInterpreterMain(nonce, exchange, out).run();
    }

    private void run() throws IOException, InterruptedException {
        var in = new BufferedReader(new InputStreamReader(System.in, UTF_8));
        reply("READY");

        String header;
        while ((header = in.readLine()) != null) {
            var parts = header.split(" ");
            switch (parts[0]) {
                case "QUIT" -> {
                    reply("BYE");
                    return;
                }
                case "OPEN" -> {
                    var plotDir = Path.of(in.readLine());
                    environments.put(parts[1], new MiniInterpreter(plotDir, out::println));
                    reply("OK");
                }
                case "EVAL" -> {
                    int count = Integer.parseInt(parts[2]);
                    var lines = new ArrayList<String>();
                    for (int i = 0; i < count; i++) {
                        lines.add(in.readLine());
                    }
                    var interpreter = environments.get(parts[1]);
                    if (interpreter == null) {
                        write("error.txt", "unknown environment " + parts[1]);
                        reply("FAULT");
                    } else {
                        reply(evaluate(interpreter, String.join("\n", lines)));
                    }
                }
                case "CLOSE" -> {
                    var interpreter = environments.remove(parts[1]);
                    if (interpreter != null) {
                        interpreter.clear();
                    }
                    reply("OK");
                }
                default -> {
                    write("error.txt", "unknown request " + parts[0]);
                    reply("FAULT");
                }
            }
        }
    }

    private String evaluate(MiniInterpreter interpreter, String code) throws IOException, InterruptedException {
        RawResult result;
        try {
            result = interpreter.evaluate(code);
        } catch (MiniInterpreter.CrashRequested e) {
            Runtime.getRuntime().halt(3);
            throw e;
        }
        switch (result.status()) {
            case PARSE_ERROR -> {
                write("error.txt", result.error());
                return "PARSE_ERROR";
            }
            case RUNTIME_ERROR -> {
                write("console.txt", result.console());
                write("error.txt", result.error());
                return "ERROR";
            }
            default -> {
                write("console.txt", result.console());
                write("value.txt", result.value());
                return "OK";
            }
        }
    }

    private void write(String name, String text) throws IOException {
        Files.writeString(exchange.resolve(name), text + "\n", UTF_8);
    }

    private void reply(String status) {
        out.println(nonce + " " + status);
        out.flush();
    }
}
