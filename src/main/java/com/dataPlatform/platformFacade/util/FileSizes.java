package com.dataPlatform.platformFacade.util;

import java.util.Locale;

/**
 * Utility class for rendering byte counts.
 */
public class FileSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    /**
     * Formats a byte count with one decimal, e.g. 1536 -> "1.5 KB".
     *
     * @param sizeBytes Size in bytes
     * @return Formatted size ("0 B" for zero)
     */
    public static String format(long sizeBytes) {
        if (sizeBytes == 0) {
            return "0 B";
        }

        double size = sizeBytes;
        int unit = 0;
        while (size >= 1024 && unit < UNITS.length - 1) {
            size /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, UNITS[unit]);
    }
}
