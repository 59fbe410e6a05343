package imgpack.pipeline;

import imgpack.*;
import imgpack.models.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveSinkTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final AtomicInteger exitCode = new AtomicInteger(-1);

    @Test
    void writesResultsInArrivalOrder() throws Exception {
        Path zip = dir.resolve("chapter1.zip");
        HandOffQueue<ResultItem> in = new HandOffQueue<>(4);
        in.put(result("p2", "two"));
        in.put(result("p1", "one"));
        in.close();
        ProgressAggregator progress = new ProgressAggregator("chapter1", 2, TestImages.quietConsole());

        int written = sink(zip, in, progress, PipelineConfig.defaults(), signal()).call();

        assertEquals(2, written);
        assertEquals(List.of("p2.webp", "p1.webp"), new ArrayList<>(TestImages.readZip(zip).keySet()));
        assertEquals(2, progress.totals().itemsProcessed());
        assertEquals(6, progress.totals().totalEncodedBytes());
    }

    @Test
    void droppedResultsAreNotWrittenAndLowerExpectedTotal() throws Exception {
        Path zip = dir.resolve("chapter1.zip");
        HandOffQueue<ResultItem> in = new HandOffQueue<>(4);
        in.put(result("p1", "one"));
        in.put(ResultItem.dropped("p2", 100));
        in.close();
        ProgressAggregator progress = new ProgressAggregator("chapter1", 2, TestImages.quietConsole());

        sink(zip, in, progress, PipelineConfig.defaults(), signal()).call();

        assertEquals(Set.of("p1.webp"), TestImages.readZip(zip).keySet());
        assertEquals(1, progress.totals().itemsExpected());
        assertEquals(100.0, progress.totals().percentComplete(), 1e-9);
    }

    @Test
    void writeFailureIsLoggedAndSinkContinues() throws Exception {
        Path zip = dir.resolve("chapter1.zip");
        HandOffQueue<ResultItem> in = new HandOffQueue<>(4);
        in.put(result("p1", "one"));
        in.put(result("p1", "again"));
        in.put(result("p2", "two"));
        in.close();
        PipelineConfig bare = new PipelineConfig(TargetFormat.PNG, 75, 0, EncodeFailurePolicy.PLACEHOLDER, false, false);
        ProgressAggregator progress = new ProgressAggregator("chapter1", 3, TestImages.quietConsole());

        int written = sink(zip, in, progress, bare, signal()).call();

        assertEquals(2, written);
        assertEquals(Set.of("p1", "p2"), TestImages.readZip(zip).keySet());
        assertTrue(TestImages.text(err).contains("write p1 to"), TestImages.text(err));
        assertEquals(3, progress.totals().itemsProcessed());
    }

    @Test
    void interruptKeepsWrittenEntriesAndStopsWriting() throws Exception {
        Path zip = dir.resolve("chapter1.zip");
        HandOffQueue<ResultItem> in = new HandOffQueue<>(4);
        ShutdownSignal signal = signal();
        ArchiveWriter archive = ArchiveWriter.create(zip);
        ArchiveSink sink = new ArchiveSink(archive, in, new ProgressAggregator("chapter1", 4, TestImages.quietConsole()),
                PipelineConfig.defaults(), signal, TestImages.capture(new ByteArrayOutputStream(), err, true));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> written = executor.submit(sink);
            in.put(result("p1", "one"));
            in.put(result("p2", "two"));
            awaitEntries(archive, 2);

            signal.trigger();

            assertTrue(archive.isClosed());
            assertEquals(0, exitCode.get());
            in.put(result("p3", "three"));
            in.close();
            assertEquals(2, written.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of("p1.webp", "p2.webp"), new ArrayList<>(TestImages.readZip(zip).keySet()));
    }

    @Test
    void archiveStaysRegisteredUntilFinished() throws Exception {
        Path zip = dir.resolve("chapter1.zip");
        HandOffQueue<ResultItem> in = new HandOffQueue<>(2);
        in.put(result("p1", "one"));
        in.close();
        List<Boolean> closedWhenReleased = new ArrayList<>();
        ShutdownSignal signal = new ShutdownSignal(TestImages.quietConsole(), exitCode::set) {
            @Override
            public void unregister(ArchiveWriter archive) {
                closedWhenReleased.add(archive.isClosed());
                super.unregister(archive);
            }
        };

        sink(zip, in, new ProgressAggregator("chapter1", 1, TestImages.quietConsole()), PipelineConfig.defaults(), signal).call();

        assertEquals(List.of(true), closedWhenReleased);
        assertEquals(Set.of("p1.webp"), TestImages.readZip(zip).keySet());
    }

    private ArchiveSink sink(Path zip, HandOffQueue<ResultItem> in, ProgressAggregator progress,
                             PipelineConfig config, ShutdownSignal signal) throws IOException {
        return new ArchiveSink(ArchiveWriter.create(zip), in, progress, config, signal,
                TestImages.capture(new ByteArrayOutputStream(), err, true));
    }

    private ShutdownSignal signal() {
        return new ShutdownSignal(TestImages.quietConsole(), exitCode::set);
    }

    private static ResultItem result(String identity, String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        return new ResultItem(identity, bytes.length * 4L, bytes);
    }

    private static void awaitEntries(ArchiveWriter archive, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (archive.entries() < expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("archive never reached " + expected + " entries");
            }
            Thread.sleep(10);
        }
    }
}
