package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.FileMetadata;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Location;
import de.mirkosertic.filequality.model.Severity;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.List;

/**
 * Flags text files whose bytes are not valid in the expected encoding.
 * Only the first offending sequence is reported, always as CRITICAL.
 */
public class EncodingRule implements QualityRule {

    public static final String NAME = "encoding";

    private static final int BUFFER_SIZE = 8192;

    private final Charset expectedEncoding;

    public EncodingRule(final Charset expectedEncoding) {
        this.expectedEncoding = expectedEncoding;
    }

    public static EncodingRule fromSettings(final RuleSettings settings) {
        return new EncodingRule(Charset.forName(settings.getString("expected-encoding", "UTF-8")));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Text files must be valid " + expectedEncoding.name();
    }

    @Override
    public boolean appliesTo(final FileMetadata metadata) {
        return metadata.text();
    }

    @Override
    public String fingerprintSource() {
        return "charset=" + expectedEncoding.name();
    }

    @Override
    public List<Finding> evaluate(final FileContent content) {
        final CharsetDecoder decoder = expectedEncoding.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        final ByteBuffer in = ByteBuffer.wrap(content.bytes());
        final CharBuffer out = CharBuffer.allocate(BUFFER_SIZE);

        CoderResult result = decoder.decode(in, out, true);
        while (result.isOverflow()) {
            out.clear();
            result = decoder.decode(in, out, true);
        }
        if (result.isUnderflow()) {
            out.clear();
            result = decoder.flush(out);
        }
        if (!result.isError()) {
            return List.of();
        }

        final int offset = in.position();
        final int line = lineAt(content.bytes(), offset);
        final String kind = result.isMalformed() ? "Malformed" : "Unmappable";
        return List.of(Finding.issue(NAME, Severity.CRITICAL,
                kind + " " + expectedEncoding.name() + " sequence of " + result.length() + " byte(s) at offset " + offset,
                Location.at(line, offset)));
    }

    private static int lineAt(final byte[] bytes, final int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                line++;
            }
        }
        return line;
    }

    public Charset getExpectedEncoding() {
        return expectedEncoding;
    }
}
