package ai.rplayground.conversion;

import java.util.Map;

/**
 * Text extracted from a PDF plus one image per page that had any.
 *
 * @param images zero-based page index to base64-encoded PNG
 */
public record ConversionResult(String text, Map<Integer, String> images) {
    public ConversionResult {
        images = images == null ? Map.of() : Map.copyOf(images);
    }
}
