package imgpack.models;

/**
 * Transcoding settings for one run. Shared read-only by every pipeline stage.
 *
 * @param targetFormat     output image format
 * @param quality          encoder quality in [1, 100], passed to the encoder uninterpreted
 * @param maxWidth         widest allowed output, 0 disables resizing
 * @param onEncodeFailure  what a worker forwards when resize or encode fails
 * @param appendExtension  whether archive entries are named {@code identity.ext} rather than {@code identity}
 * @param verifyContent    whether sources are MIME-sniffed before decoding
 */
public record PipelineConfig(
        TargetFormat targetFormat,
        float quality,
        int maxWidth,
        EncodeFailurePolicy onEncodeFailure,
        boolean appendExtension,
        boolean verifyContent
) {

    public static final float MIN_QUALITY = 1;
    public static final float MAX_QUALITY = 100;
    public static final float DEFAULT_QUALITY = 75;
    public static final int DEFAULT_MAX_WIDTH = 1080;

    public PipelineConfig {
        if (targetFormat == null) {
            throw new IllegalArgumentException("Output format is required");
        }
        if (Float.isNaN(quality) || quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException(String.format(
                    "Quality must be between %.0f and %.0f, got %s", MIN_QUALITY, MAX_QUALITY, quality));
        }
        if (maxWidth < 0) {
            throw new IllegalArgumentException("Max width must not be negative, got " + maxWidth);
        }
        if (onEncodeFailure == null) {
            onEncodeFailure = EncodeFailurePolicy.PLACEHOLDER;
        }
    }

    public PipelineConfig(TargetFormat targetFormat, float quality, int maxWidth) {
        this(targetFormat, quality, maxWidth, EncodeFailurePolicy.PLACEHOLDER, true, false);
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(TargetFormat.WEBP, DEFAULT_QUALITY, DEFAULT_MAX_WIDTH);
    }

    public boolean resizeRequired(int sourceWidth) {
        return maxWidth > 0 && sourceWidth > maxWidth;
    }

    public String entryName(String identity) {
        return appendExtension ? identity + "." + targetFormat.extension() : identity;
    }
}
