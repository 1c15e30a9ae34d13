package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.model.FileMetadata;
import org.apache.tika.Tika;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Builds {@link FileMetadata} from a file's name and leading bytes using Tika's
 * magic-byte and file-name detection.
 */
public class MediaTypeDetector {

    static final int DETECTION_WINDOW = 8192;

    private static final Set<String> BINARY_TOP_LEVEL_TYPES = Set.of("image", "audio", "video");
    private static final Set<String> BINARY_TYPES = Set.of(
            "application/pdf",
            "application/zip",
            "application/gzip",
            "application/x-gzip",
            "application/java-archive",
            "application/x-tar",
            "application/x-7z-compressed",
            "application/x-rar-compressed",
            "application/x-executable");

    private final Tika tika;

    public MediaTypeDetector() {
        this(new Tika());
    }

    MediaTypeDetector(final Tika tika) {
        this.tika = tika;
    }

    public FileMetadata describe(final Path path, final Path relativePath, final byte[] content) {
        final byte[] head = content.length > DETECTION_WINDOW ? Arrays.copyOf(content, DETECTION_WINDOW) : content;
        final String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        final String mediaType = tika.detect(head, fileName);
        return new FileMetadata(path, relativePath, content.length, extensionOf(fileName), mediaType,
                isText(head, mediaType));
    }

    static String extensionOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static boolean isText(final byte[] head, final String mediaType) {
        for (final byte b : head) {
            if (b == 0) {
                return false;
            }
        }
        final String baseType = mediaType.toLowerCase(Locale.ROOT).split(";")[0].trim();
        final int slash = baseType.indexOf('/');
        final String topLevel = slash > 0 ? baseType.substring(0, slash) : baseType;
        if (BINARY_TOP_LEVEL_TYPES.contains(topLevel)) {
            return false;
        }
        return !BINARY_TYPES.contains(baseType);
    }
}
