package imgpack.pipeline;

import imgpack.codec.*;
import imgpack.models.*;
import imgpack.utils.*;
import org.apache.tika.*;

import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;

/**
 * Producer stage: decodes every eligible image directly inside one input directory and emits
 * it as a {@link WorkItem}. A file that cannot be read, sniffed or decoded is reported and
 * skipped. Returns the number of emitted items.
 */
public class SourceEnumerator implements Callable<Integer> {

    private final Path inputDir;
    private final ImageCodec codec;
    private final Emitter<WorkItem> out;
    private final ConsoleLog console;
    private final Tika tika;
    private int skipped;

    public SourceEnumerator(Path inputDir, PipelineConfig config, ImageCodec codec, Emitter<WorkItem> out, ConsoleLog console) {
        this.inputDir = inputDir;
        this.codec = codec;
        this.out = out;
        this.console = console;
        this.tika = config.verifyContent() ? new Tika() : null;
    }

    @Override
    public Integer call() throws InterruptedException {
        List<Path> files;
        try {
            files = ImageFiles.listEligible(inputDir);
        } catch (IOException | UncheckedIOException e) {
            console.error("open %s failed: %s", inputDir, e.getMessage());
            return 0;
        }

        int emitted = 0;
        for (Path file : files) {
            WorkItem item = load(file);
            if (item == null) {
                skipped++;
                continue;
            }
            out.emit(item);
            emitted++;
        }
        return emitted;
    }

    public int skipped() {
        return skipped;
    }

    private WorkItem load(Path file) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            console.error("stat %s failed: %s", file, e.getMessage());
            return null;
        }
        if (tika != null) {
            String mimeType;
            try {
                mimeType = MimeUtils.detect(tika, file);
            } catch (IOException | RuntimeException e) {
                console.error("sniff %s failed: %s", file, e.getMessage());
                return null;
            }
            if (!MimeUtils.isImage(mimeType)) {
                console.error("skip %s: content is %s, not an image", file, mimeType);
                return null;
            }
        }
        try {
            BufferedImage image = codec.decode(file);
            return new WorkItem(ImageFiles.stripExtension(file.getFileName().toString()), size, image);
        } catch (IOException | RuntimeException e) {
            console.error("decode %s failed: %s", file, e.getMessage());
            return null;
        }
    }
}
