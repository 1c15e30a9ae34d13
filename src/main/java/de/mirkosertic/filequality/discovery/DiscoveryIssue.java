package de.mirkosertic.filequality.discovery;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.nio.file.Path;

/**
 * A path that was skipped during discovery because it could not be read.
 */
public record DiscoveryIssue(
        @JsonSerialize(using = ToStringSerializer.class) Path path,
        String message
) {
}
