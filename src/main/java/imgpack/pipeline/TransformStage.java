package imgpack.pipeline;

import imgpack.codec.*;
import imgpack.models.*;
import imgpack.utils.*;

import java.awt.image.*;
import java.io.*;

/**
 * Worker stage: shrinks an image to the configured max width when it is wider, then encodes it
 * into the target format. When either step fails the item is forwarded according to
 * {@link PipelineConfig#onEncodeFailure()}.
 */
public class TransformStage implements Stage<WorkItem, ResultItem> {

    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ConsoleLog console;

    public TransformStage(PipelineConfig config, ImageCodec codec, ConsoleLog console) {
        this.config = config;
        this.codec = codec;
        this.console = console;
    }

    @Override
    public void process(WorkItem item, Emitter<ResultItem> out) throws InterruptedException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            BufferedImage image = item.payload();
            if (config.resizeRequired(image.getWidth())) {
                image = codec.resize(image, config.maxWidth());
            }
            codec.encode(image, config.targetFormat(), config.quality(), buf);
        } catch (IOException | RuntimeException e) {
            console.error("file %s format %s failed: %s", item.identity(), config.targetFormat().extension(), e.getMessage());
            if (config.onEncodeFailure() == EncodeFailurePolicy.SKIP) {
                out.emit(ResultItem.dropped(item.identity(), item.originalSize()));
                return;
            }
        }
        out.emit(new ResultItem(item.identity(), item.originalSize(), buf.toByteArray()));
    }
}
