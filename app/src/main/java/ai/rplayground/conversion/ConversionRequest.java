package ai.rplayground.conversion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * One JSON line sent to the conversion worker: either a conversion or a request to exit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record ConversionRequest(String type, long id, @Nullable String pdfPath) {
    static final String CONVERT = "convert";
    static final String QUIT = "quit";

    static ConversionRequest convert(long id, String pdfPath) {
        return new ConversionRequest(CONVERT, id, pdfPath);
    }

    static ConversionRequest quit() {
        return new ConversionRequest(QUIT, 0, null);
    }
}
