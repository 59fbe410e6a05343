package imgpack.models;

import java.awt.image.*;

// A decoded source image on its way from the enumerator to a transform worker.
public record WorkItem(
        String identity,
        long originalSize,
        BufferedImage payload
) {
}
