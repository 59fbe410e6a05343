package imgpack.utils;

import java.util.*;

public class SizeUtils {
    private static final int UNIT = 1024;
    private static final String UNIT_PREFIXES = "KMGTPE";

    private SizeUtils() {}

    /**
     * Converts a size in bytes to a human-readable string using binary prefixes.
     * Examples:  512       → "512 B"
     *            2048      → "2.0 KiB"
     *            5_242_880 → "5.0 MiB"
     */
    public static String humanReadable(long bytes) {
        if (bytes < UNIT) {
            return bytes + " B";
        }
        long div = UNIT;
        int exp = 0;
        for (long n = bytes / UNIT; n >= UNIT; n /= UNIT) {
            div *= UNIT;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %ciB", (double) bytes / div, UNIT_PREFIXES.charAt(exp));
    }
}
