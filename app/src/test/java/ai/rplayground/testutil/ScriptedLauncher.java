package ai.rplayground.testutil;

import ai.rplayground.worker.InterpreterLauncher;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches {@link ScriptedInterpreterMain} in a child JVM on the test classpath.
 */
public final class ScriptedLauncher implements InterpreterLauncher {
    private final List<String> flags;

    public ScriptedLauncher(String... flags) {
        this.flags = List.of(flags);
    }

    @Override
    public List<String> command(Path exchangeDir) {
        var classpath = System.getProperty("java.class.path");
        if (classpath == null || classpath.isBlank()) {
            throw new IllegalStateException("Cannot resolve java.class.path");
        }
        var command = new ArrayList<String>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-Djava.awt.headless=true");
        command.add("-cp");
        command.add(classpath);
        command.add(ScriptedInterpreterMain.class.getName());
        command.addAll(flags);
        return command;
    }
}
