package ai.rplayground.session;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageHarvesterTest {
    @TempDir
    Path tempDir;

    private Path writePng(String name, int width, int height) throws Exception {
        var file = tempDir.resolve(name);
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", file.toFile());
        return file;
    }

    @Test
    void testHarvestsAndDeletesPlots() throws Exception {
        writePng("plot_20240101000000_1_1234.png", 30, 20);
        var unrelated = Files.writeString(tempDir.resolve("data.csv"), "a,b\n");

        var images = new ImageHarvester(tempDir).harvest(true);

        assertEquals(1, images.size());
        var image = images.get(0);
        assertEquals("plot_20240101000000_1_1234.png", image.fileName());
        assertEquals("png", image.format());
        assertEquals(30, image.width());
        assertEquals(20, image.height());
        assertTrue(image.size() > 0);
        assertTrue(Files.exists(unrelated));
        try (var files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().startsWith("plot_")));
        }
    }

    @Test
    void testUndecodableFileIsSkippedButDeleted() throws Exception {
        var broken = Files.writeString(tempDir.resolve("plot_broken.png"), "not an image");
        writePng("plot_ok.png", 4, 4);

        var images = new ImageHarvester(tempDir).harvest(true);

        assertEquals(1, images.size());
        assertEquals("plot_ok.png", images.get(0).fileName());
        assertFalse(Files.exists(broken));
    }

    @Test
    void testDisabledDecodingOnlyDeletes() throws Exception {
        var plot = writePng("plot_a.png", 4, 4);

        var images = new ImageHarvester(tempDir).harvest(false);

        assertTrue(images.isEmpty());
        assertFalse(Files.exists(plot));
    }

    @Test
    void testSecondHarvestFindsNothing() throws Exception {
        writePng("plot_a.png", 4, 4);
        var harvester = new ImageHarvester(tempDir);

        assertEquals(1, harvester.harvest(true).size());
        assertEquals(0, harvester.harvest(true).size());
    }

    @Test
    void testMissingDirectoryIsAnError() {
        var harvester = new ImageHarvester(tempDir.resolve("gone"));

        assertThrows(IOException.class, () -> harvester.harvest(true));
    }
}
