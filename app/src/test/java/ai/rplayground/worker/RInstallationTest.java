package ai.rplayground.worker;

import static org.junit.jupiter.api.Assertions.*;

import ai.rplayground.worker.InterpreterWorker.WorkerException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RInstallationTest {
    @TempDir
    Path tempDir;

    @Test
    void testWithoutRHomeUsesPath() throws Exception {
        assertEquals("Rscript", new RInstallation(null).rscript());
    }

    @Test
    void testMissingRHomeIsRejected() {
        var installation = new RInstallation(tempDir.resolve("missing"));

        assertThrows(WorkerException.class, installation::rscript);
    }

    @Test
    void testRHomeWithoutRscriptIsRejected() throws Exception {
        Files.createDirectories(tempDir.resolve("bin"));
        var installation = new RInstallation(tempDir);

        var e = assertThrows(WorkerException.class, installation::rscript);
        assertTrue(e.getMessage().contains("No executable Rscript"), e.getMessage());
    }

    @Test
    void testStagesBootstrapScript() throws Exception {
        var bin = Files.createDirectories(tempDir.resolve("r").resolve("bin"));
        var rscript = Files.writeString(bin.resolve("Rscript"), "#!/bin/sh\n");
        try {
            Files.setPosixFilePermissions(rscript, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            rscript.toFile().setExecutable(true);
        }
        var exchange = Files.createDirectories(tempDir.resolve("exchange"));

        var command = new RInstallation(tempDir.resolve("r")).command(exchange);

        assertEquals(rscript.toString(), command.get(0));
        assertEquals("--vanilla", command.get(1));
        var script = Path.of(command.get(2));
        assertTrue(Files.exists(script));
        assertTrue(Files.readString(script).contains("get_img_dest_file_name"));
    }
}
