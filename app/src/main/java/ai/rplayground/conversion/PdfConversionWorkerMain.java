package ai.rplayground.conversion;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.imageio.ImageIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the conversion worker JVM started by {@link ProcessPdfConverter}.
 *
 * <p>Reads one {@link ConversionRequest} per stdin line and answers with one {@link WorkerMessage}
 * per stdout line. Anything else that would reach stdout is redirected to stderr.
 */
public final class PdfConversionWorkerMain {
    private static final Logger logger = LogManager.getLogger(PdfConversionWorkerMain.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final PrintStream protocolOut;

    private PdfConversionWorkerMain(PrintStream protocolOut) {
        this.protocolOut = protocolOut;
    }

    public static void main(String[] args) throws IOException {
        var protocolOut = new PrintStream(new FileOutputStream(FileDescriptor.out), true, UTF_8);
        System.setOut(System.err);
        new PdfConversionWorkerMain(protocolOut).run();
    }

    private void run() throws IOException {
        try {
            // loads the text extraction machinery before the first request
            new PDFTextStripper();
        } catch (RuntimeException | LinkageError e) {
            logger.error("PDF conversion worker failed to initialize", e);
            send(WorkerMessage.initFailed(String.valueOf(e.getMessage())));
            return;
        }
        send(WorkerMessage.ready());

        var reader = new BufferedReader(new InputStreamReader(System.in, UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            ConversionRequest request;
            try {
                request = objectMapper.readValue(line, ConversionRequest.class);
            } catch (IOException e) {
                logger.warn("Ignoring malformed request: {}", line);
                continue;
            }
            if (ConversionRequest.QUIT.equals(request.type())) {
                logger.debug("Conversion worker exiting on request");
                return;
            }
            send(handle(request));
        }
    }

    private WorkerMessage handle(ConversionRequest request) {
        if (request.pdfPath() == null) {
            return WorkerMessage.error(request.id(), "Missing pdfPath");
        }
        try {
            var pdf = Path.of(request.pdfPath());
            if (!Files.isRegularFile(pdf)) {
                throw new NoSuchFileException(request.pdfPath(), null, "PDF file not found");
            }
            try (var document = Loader.loadPDF(pdf.toFile())) {
                var text = new PDFTextStripper().getText(document);
                return WorkerMessage.result(request.id(), text, extractImages(document));
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Conversion of {} failed", request.pdfPath(), e);
            return WorkerMessage.error(request.id(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static Map<Integer, String> extractImages(PDDocument document) throws IOException {
        var images = new LinkedHashMap<Integer, String>();
        int index = 0;
        for (var page : document.getPages()) {
            var encoded = firstImage(page);
            if (encoded != null) {
                images.put(index, encoded);
            }
            index++;
        }
        return images;
    }

    @Nullable
    private static String firstImage(PDPage page) throws IOException {
        var resources = page.getResources();
        if (resources == null) {
            return null;
        }
        for (var name : resources.getXObjectNames()) {
            var xObject = resources.getXObject(name);
            if (xObject instanceof PDImageXObject image) {
                var buffer = new ByteArrayOutputStream();
                ImageIO.write(image.getImage(), "png", buffer);
                return Base64.getEncoder().encodeToString(buffer.toByteArray());
            }
        }
        return null;
    }

    private void send(WorkerMessage message) throws IOException {
        protocolOut.println(objectMapper.writeValueAsString(message));
        protocolOut.flush();
    }
}
