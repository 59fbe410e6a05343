package imgpack.utils;

import org.apache.tika.*;

import java.io.*;
import java.nio.file.*;

public class MimeUtils {

    public static final String UNKNOWN_MIME_TYPE = "application/octet-stream";

    private MimeUtils() {}

    public static boolean isImage(String mimeType) {
        if (mimeType == null) return false;
        return mimeType.toLowerCase().startsWith("image/");
    }

    // detected type without parameters, e.g. "image/png"
    public static String detect(Tika tika, Path file) throws IOException {
        String full = tika.detect(file);
        return full != null ? full.split(";")[0].trim() : UNKNOWN_MIME_TYPE;
    }
}
