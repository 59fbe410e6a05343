package imgpack.pipeline;

import imgpack.codec.*;
import imgpack.models.*;
import imgpack.utils.*;

import java.io.*;
import java.nio.file.*;
import java.util.concurrent.*;

/**
 * Runs the enumerate, transform and archive pipeline for one input directory:
 * <pre>
 *   SourceEnumerator -> [decoded] -> N x TransformStage -> [encoded] -> ArchiveSink
 * </pre>
 * Both queues hold at most {@code concurrency} items. Each queue is closed only after every
 * producer feeding it has finished.
 */
public class UnitOfWorkOrchestrator {
    public static final String ARCHIVE_EXTENSION = ".zip";

    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ShutdownSignal signal;
    private final ConsoleLog console;

    public UnitOfWorkOrchestrator(PipelineConfig config, ImageCodec codec, ShutdownSignal signal, ConsoleLog console) {
        this.config = config;
        this.codec = codec;
        this.signal = signal;
        this.console = console;
    }

    /**
     * Packs {@code inputDir} into {@code <outputRoot>/<inputDir name>.zip}.
     *
     * @return the unit's report, with no archive when the directory holds no eligible image
     * @throws IOException when the archive file cannot be created; nothing was started then
     */
    public UnitReport run(Path inputDir, Path outputRoot, int concurrency) throws IOException, InterruptedException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        String unitName = unitName(inputDir);
        int expected = ImageFiles.countEligible(inputDir);
        if (expected == 0) {
            return UnitReport.empty(unitName);
        }

        Path archivePath = outputRoot.resolve(unitName + ARCHIVE_EXTENSION);
        ArchiveWriter archive = ArchiveWriter.create(archivePath);
        signal.register(archive);

        HandOffQueue<WorkItem> decoded = new HandOffQueue<>(concurrency);
        HandOffQueue<ResultItem> encoded = new HandOffQueue<>(concurrency);
        ProgressAggregator progress = new ProgressAggregator(unitName, expected, console);

        SourceEnumerator enumerator = new SourceEnumerator(inputDir, config, codec, decoded, console);
        WorkerPool<WorkItem, ResultItem> workers = new WorkerPool<>(
                "transform-" + unitName, concurrency, new TransformStage(config, codec, console), decoded, encoded, console);
        ArchiveSink sink = new ArchiveSink(archive, encoded, progress, config, signal, console);

        ExecutorService enumeratorExecutor = Executors.newSingleThreadExecutor(new NamedThreads("enumerate-" + unitName));
        ExecutorService sinkExecutor = Executors.newSingleThreadExecutor(new NamedThreads("archive-" + unitName));
        try {
            Future<Integer> emitted = enumeratorExecutor.submit(enumerator);
            workers.start();
            Future<Integer> written = sinkExecutor.submit(sink);
            enumeratorExecutor.shutdown();
            sinkExecutor.shutdown();

            await(emitted, "enumerating " + inputDir, 0);
            decoded.close();
            workers.awaitCompletion();
            encoded.close();
            int entries = await(written, "archiving " + archivePath, archive.entries());

            return new UnitReport(unitName, archivePath, progress.totals(), entries, signal.isTriggered());
        } catch (InterruptedException e) {
            enumeratorExecutor.shutdownNow();
            workers.abort();
            sinkExecutor.shutdownNow();
            throw e;
        } finally {
            try {
                archive.finish();
            } catch (IOException e) {
                console.error("closing %s failed: %s", archivePath, e.getMessage());
            }
            signal.unregister(archive);
        }
    }

    static String unitName(Path inputDir) {
        Path name = inputDir.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : "root";
    }

    private int await(Future<Integer> task, String what, int fallback) throws InterruptedException {
        try {
            return task.get();
        } catch (ExecutionException e) {
            console.error("%s failed: %s", what, e.getCause());
            return fallback;
        }
    }
}
