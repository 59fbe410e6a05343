package imgpack.codec;

import imgpack.models.*;

import javax.imageio.*;
import javax.imageio.stream.*;
import java.awt.*;
import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * {@link ImageCodec} backed by ImageIO and Java2D. WebP support comes from the
 * webp-imageio plugin found on the class path.
 */
public class ImageIoCodec implements ImageCodec {

    private static final String LOSSY_COMPRESSION = "Lossy";

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new IOException("no decoder for " + file.getFileName());
            }
            return image;
        }
    }

    @Override
    public BufferedImage resize(BufferedImage image, int width) {
        int height = Math.max(1, (int) Math.round((double) image.getHeight() * width / image.getWidth()));
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        // bilinear halving until within 2x of the target, then one bicubic pass
        BufferedImage current = image;
        int w = image.getWidth();
        int h = image.getHeight();
        while (w / 2 >= width) {
            w /= 2;
            h = Math.max(height, h / 2);
            current = draw(current, w, h, type, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }
        return draw(current, width, height, type, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }

    @Override
    public void encode(BufferedImage image, TargetFormat format, float quality, OutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.imageIoName());
        if (!writers.hasNext()) {
            throw new IOException("unsupported output format: " + format.imageIoName());
        }
        ImageWriter writer = writers.next();
        BufferedImage source = format.supportsAlpha() ? image : withoutAlpha(image);
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(source, null, null), writeParam(writer, quality));
            ios.flush();
        } finally {
            writer.dispose();
        }
    }

    private static ImageWriteParam writeParam(ImageWriter writer, float quality) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (!param.canWriteCompressed()) {
            return param;
        }
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] types = param.getCompressionTypes();
        if (types != null && types.length > 0) {
            param.setCompressionType(Arrays.asList(types).contains(LOSSY_COMPRESSION) ? LOSSY_COMPRESSION : types[0]);
        }
        if (!param.isCompressionLossless()) {
            param.setCompressionQuality(quality / PipelineConfig.MAX_QUALITY);
        }
        return param;
    }

    private static BufferedImage withoutAlpha(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage draw(BufferedImage source, int width, int height, int type, Object interpolation) {
        BufferedImage target = new BufferedImage(width, height, type);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
