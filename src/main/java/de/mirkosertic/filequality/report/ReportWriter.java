package de.mirkosertic.filequality.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link RunReport} as JSON.
 * <p>
 * Map keys are sorted and the timestamp is written as ISO-8601, so two reports over the
 * same files differ only in their {@code timestamp}.
 */
public final class ReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    private ReportWriter() {
    }

    public static String toJson(final RunReport report) {
        try {
            return OBJECT_MAPPER.writeValueAsString(report);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize report", e);
        }
    }

    public static void write(final RunReport report, final Path target) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final OutputStream out = Files.newOutputStream(target)) {
            write(report, out);
        }
        logger.info("Report with {} files written to {}", report.results().size(), target);
    }

    /**
     * Write to a stream that stays open afterwards, e.g. {@code System.out}.
     */
    public static void write(final RunReport report, final OutputStream out) throws IOException {
        OBJECT_MAPPER.writeValue(out, report);
        out.write('\n');
        out.flush();
    }
}
