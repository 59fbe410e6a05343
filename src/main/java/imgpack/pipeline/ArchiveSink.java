package imgpack.pipeline;

import imgpack.models.*;
import imgpack.utils.*;

import java.io.*;
import java.util.concurrent.*;

/**
 * Terminal stage: writes results into the unit's archive in arrival order and feeds the
 * progress aggregator. Returns the number of entries written.
 */
public class ArchiveSink implements Callable<Integer> {

    private final ArchiveWriter archive;
    private final HandOffQueue<ResultItem> in;
    private final ProgressAggregator progress;
    private final PipelineConfig config;
    private final ShutdownSignal signal;
    private final ConsoleLog console;
    private int written;

    public ArchiveSink(ArchiveWriter archive, HandOffQueue<ResultItem> in, ProgressAggregator progress,
                       PipelineConfig config, ShutdownSignal signal, ConsoleLog console) {
        this.archive = archive;
        this.in = in;
        this.progress = progress;
        this.config = config;
        this.signal = signal;
        this.console = console;
    }

    @Override
    public Integer call() throws InterruptedException {
        signal.register(archive);
        progress.start();
        try {
            ResultItem item;
            while ((item = in.take()) != null) {
                // interrupted: drain without writing
                if (signal.isTriggered()) continue;
                try {
                    consume(item);
                } catch (RuntimeException e) {
                    console.error("archiving %s failed: %s", item.identity(), e);
                }
            }
        } finally {
            try {
                archive.finish();
            } catch (IOException e) {
                console.error("closing %s failed: %s", archive.path(), e.getMessage());
            }
            // only once the central directory is on disk
            signal.unregister(archive);
            progress.finish();
        }
        return written;
    }

    private void consume(ResultItem item) {
        if (item.dropped()) {
            progress.discount();
            return;
        }
        String entryName = config.entryName(item.identity());
        try {
            if (!archive.write(entryName, item.encodedPayload())) {
                return;
            }
            written++;
        } catch (IOException e) {
            console.error("write %s to %s failed: %s", entryName, archive.path(), e.getMessage());
        }
        progress.record(item.originalSize(), item.encodedSize());
    }
}
