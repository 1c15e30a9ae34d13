package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.FileMetadata;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

final class RuleTestSupport {

    private RuleTestSupport() {
    }

    static FileContent text(final String relativePath, final String content) {
        return content(relativePath, content.getBytes(StandardCharsets.UTF_8), true);
    }

    static FileContent content(final String relativePath, final byte[] bytes, final boolean text) {
        final Path relative = Path.of(relativePath);
        final Path absolute = Path.of("/project").resolve(relative);
        final String name = relative.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        final String extension = dot > 0 ? name.substring(dot + 1) : "";
        final FileMetadata metadata = new FileMetadata(absolute, relative, bytes.length, extension,
                text ? "text/plain" : "application/octet-stream", text);
        return new FileContent(metadata, bytes);
    }
}
