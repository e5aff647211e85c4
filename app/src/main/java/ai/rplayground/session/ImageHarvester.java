package ai.rplayground.session;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.imageio.ImageIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Collects the plot files a session's guest code wrote into the session directory.
 * Every {@code plot_*} file found is deleted, whether or not it could be decoded.
 */
public final class ImageHarvester {
    private static final Logger logger = LogManager.getLogger(ImageHarvester.class);

    static final String PLOT_PREFIX = "plot_";

    private final Path directory;

    public ImageHarvester(Path directory) {
        this.directory = directory;
    }

    /**
     * @param decode whether to read the images back; when false the files are only removed
     * @return the decoded images in directory listing order
     * @throws IOException if the directory cannot be listed
     */
    public List<PlotImage> harvest(boolean decode) throws IOException {
        List<Path> files;
        try (var stream = Files.list(directory)) {
            files = stream.filter(p -> p.getFileName().toString().startsWith(PLOT_PREFIX))
                    .filter(Files::isRegularFile)
                    .toList();
        }

        var images = new ArrayList<PlotImage>(files.size());
        for (var file : files) {
            try {
                if (decode) {
                    var image = read(file);
                    if (image != null) {
                        images.add(image);
                    }
                }
            } finally {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.warn("Failed to delete plot file {}", file, e);
                }
            }
        }
        if (!files.isEmpty()) {
            logger.debug("Harvested {} of {} plot files from {}", images.size(), files.size(), directory);
        }
        return images;
    }

    @Nullable
    private static PlotImage read(Path file) {
        var fileName = file.getFileName().toString();
        try {
            var bytes = Files.readAllBytes(file);
            var decoded = ImageIO.read(new ByteArrayInputStream(bytes));
            if (decoded == null) {
                logger.warn("No image reader for plot file {}; skipping", fileName);
                return null;
            }
            return new PlotImage(fileName, extension(fileName), decoded.getWidth(), decoded.getHeight(), bytes);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to load plot file {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    private static String extension(String fileName) {
        var dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
