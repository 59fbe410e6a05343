package imgpack.utils;

public class StringUtils {
    private StringUtils() {}

    public static String getOrDefault(String value, String def) {
        return value != null && !value.isBlank() ? value : def;
    }

    public static String formatHMS(long ms) {
        long s = ms / 1000;
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }
}
