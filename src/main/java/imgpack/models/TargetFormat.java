package imgpack.models;

import java.util.*;

public enum TargetFormat {
    WEBP("webp", "webp"),
    JPEG("jpeg", "jpg"),
    PNG("png", "png"),
    GIF("gif", "gif");

    private final String imageIoName;
    private final String extension;

    TargetFormat(String imageIoName, String extension) {
        this.imageIoName = imageIoName;
        this.extension = extension;
    }

    // format name understood by ImageIO.getImageWritersByFormatName
    public String imageIoName() {
        return imageIoName;
    }

    public String extension() {
        return extension;
    }

    public boolean supportsAlpha() {
        return this != JPEG;
    }

    public static TargetFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Output format must not be empty");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "webp":
                return WEBP;
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return PNG;
            case "gif":
                return GIF;
            default:
                throw new IllegalArgumentException(String.format(
                        "Unsupported output format '%s' (expected webp, jpg, jpeg, png or gif)", value));
        }
    }
}
