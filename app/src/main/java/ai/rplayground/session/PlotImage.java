package ai.rplayground.session;

import java.util.Arrays;

/**
 * A plot written by guest code through {@code get_img_dest_file_name()}, read back into memory.
 *
 * @param fileName the name the file had in the session directory
 * @param format lower-case file extension, e.g. {@code png}
 * @param bytes the encoded image exactly as written by R
 */
public record PlotImage(String fileName, String format, int width, int height, byte[] bytes) {
    public PlotImage {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlotImage other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && fileName.equals(other.fileName)
                && format.equals(other.format)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * fileName.hashCode() + width) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "PlotImage[" + fileName + ", " + format + ", " + width + "x" + height + ", " + bytes.length + " bytes]";
    }
}
