package ai.rplayground.worker;

import ai.rplayground.worker.InterpreterWorker.WorkerException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds the command line that starts an interpreter speaking the worker protocol.
 * {@link RProcess} appends the protocol nonce and the exchange directory as the last two arguments.
 */
@FunctionalInterface
public interface InterpreterLauncher {
    /**
     * @param exchangeDir private directory of the process being started; launchers may stage files there
     * @return the command, without the trailing nonce and exchange directory arguments
     * @throws WorkerException if the interpreter installation is missing or unusable
     */
    List<String> command(Path exchangeDir) throws WorkerException;
}
