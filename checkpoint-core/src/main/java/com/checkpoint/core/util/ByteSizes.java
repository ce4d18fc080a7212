package com.checkpoint.core.util;

import java.util.Locale;

/**
 * Human-readable byte counts for log output.
 */
public final class ByteSizes {

    private static final int UNIT = 1024;
    private static final String PREFIXES = "KMGTPE";

    private ByteSizes() {
        // Utility class
    }

    /**
     * Formats a byte count with a binary prefix, e.g. {@code 1536 -> "1.5 KB"}.
     *
     * @param bytes byte count
     * @return formatted size
     */
    public static String format(long bytes) {
        if (bytes < UNIT) {
            return bytes + " B";
        }
        long div = UNIT;
        int exp = 0;
        for (long n = bytes / UNIT; n >= UNIT; n /= UNIT) {
            div *= UNIT;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %cB", (double) bytes / div, PREFIXES.charAt(exp));
    }
}
