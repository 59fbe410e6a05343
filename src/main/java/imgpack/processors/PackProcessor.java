package imgpack.processors;

import imgpack.*;
import imgpack.codec.*;
import imgpack.models.*;
import imgpack.pipeline.*;
import imgpack.utils.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Packs every immediate subdirectory of a root directory into its own archive, one directory
 * at a time.
 */
public class PackProcessor implements Processor {
    private static final String STARTUP_FORMAT = "Starting with %d threads, format=%s, quality=%.0f, max-width=%s.%n";
    private static final String DONE_FORMAT    = "Done. elapsed %s, archives %,d, images %,d, %s -> %s%n";

    private final Path rootDir;
    private final Path outputDir;
    private final int threadCount;
    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ConsoleLog console;
    private final ShutdownSignal signal;

    private final List<UnitReport> reports = new ArrayList<>();
    private int failedUnits;

    public PackProcessor(Path rootDir, Path outputDir, int threadCount, PipelineConfig config,
                         ImageCodec codec, ShutdownSignal signal, ConsoleLog console) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threadCount);
        }
        this.rootDir = rootDir;
        this.outputDir = outputDir != null ? outputDir : rootDir;
        this.threadCount = threadCount;
        this.config = config;
        this.codec = codec;
        this.signal = signal;
        this.console = console;
    }

    @Override
    public int run() {
        if (!Files.isDirectory(rootDir)) {
            console.error("%s is not a directory.", rootDir);
            return ExitCode.INVALID_INPUT;
        }
        List<Path> inputSets;
        try {
            Files.createDirectories(outputDir);
            inputSets = ImageFiles.listSubdirectories(rootDir);
        } catch (IOException | UncheckedIOException e) {
            console.error("reading %s failed: %s", rootDir, e.getMessage());
            return ExitCode.ERROR;
        }

        if (inputSets.isEmpty()) {
            console.warn("no subdirectories to pack in %s", rootDir);
        }

        long startTime = System.currentTimeMillis();
        printStartupSummary();

        UnitOfWorkOrchestrator orchestrator = new UnitOfWorkOrchestrator(config, codec, signal, console);
        for (Path inputSet : inputSets) {
            try {
                reports.add(orchestrator.run(inputSet, outputDir, threadCount));
            } catch (IOException e) {
                failedUnits++;
                console.error("processing directory %s failed: %s", inputSet.getFileName(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                console.error("interrupted while processing %s", inputSet.getFileName());
                return ExitCode.ERROR;
            }
        }

        printCompletionSummary(System.currentTimeMillis() - startTime);
        return failedUnits == 0 ? ExitCode.OK : ExitCode.ERROR;
    }

    public List<UnitReport> reports() {
        return Collections.unmodifiableList(reports);
    }

    public int failedUnits() {
        return failedUnits;
    }

    private void printStartupSummary() {
        console.info(STARTUP_FORMAT, threadCount, config.targetFormat().extension(), config.quality(),
                config.maxWidth() > 0 ? String.valueOf(config.maxWidth()) : "off");
        console.info("Output directory: %s%n", outputDir.toAbsolutePath().normalize());
    }

    private void printCompletionSummary(long elapsedMs) {
        int archives = 0;
        int images = 0;
        long originalBytes = 0;
        long encodedBytes = 0;
        for (UnitReport report : reports) {
            if (!report.archived()) continue;
            archives++;
            images += report.entriesWritten();
            originalBytes += report.totals().totalOriginalBytes();
            encodedBytes += report.totals().totalEncodedBytes();
        }
        console.info(DONE_FORMAT, StringUtils.formatHMS(elapsedMs), archives, images,
                SizeUtils.humanReadable(originalBytes), SizeUtils.humanReadable(encodedBytes));
    }
}
