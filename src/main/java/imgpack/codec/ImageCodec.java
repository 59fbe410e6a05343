package imgpack.codec;

import imgpack.models.*;

import java.awt.image.*;
import java.io.*;
import java.nio.file.*;

/**
 * Decode, resample and encode operations used by the pipeline. Implementations must be
 * safe to call from several worker threads at once.
 */
public interface ImageCodec {

    /**
     * Decodes {@code file} into memory.
     *
     * @throws IOException when the file cannot be read or no decoder understands its content
     */
    BufferedImage decode(Path file) throws IOException;

    /** Scales {@code image} to {@code width} pixels wide, preserving its aspect ratio. */
    BufferedImage resize(BufferedImage image, int width);

    /**
     * Encodes {@code image} into {@code out}. On failure, whatever was already written to
     * {@code out} stays there.
     */
    void encode(BufferedImage image, TargetFormat format, float quality, OutputStream out) throws IOException;
}
