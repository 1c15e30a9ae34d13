package de.mirkosertic.filequality.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 content fingerprints used for change detection, cache keys and duplicate grouping.
 */
public final class Fingerprint {

    private static final String ALGORITHM = "SHA-256";

    private Fingerprint() {
    }

    /**
     * Fingerprint of the raw bytes.
     */
    public static String of(final byte[] content) {
        return toHex(newDigest().digest(content));
    }

    /**
     * Fingerprint of the bytes with all ASCII whitespace removed, so that files differing
     * only in indentation, line endings or trailing blanks share a fingerprint.
     */
    public static String normalized(final byte[] content) {
        final MessageDigest digest = newDigest();
        for (final byte b : content) {
            if (!isWhitespace(b)) {
                digest.update(b);
            }
        }
        return toHex(digest.digest());
    }

    /**
     * Fingerprint of a string, UTF-8 encoded.
     */
    public static String of(final String value) {
        return of(value.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isWhitespace(final byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE is required to provide SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(final byte[] hash) {
        final StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
