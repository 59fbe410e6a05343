package imgpack.commands;

import imgpack.codec.*;
import imgpack.models.*;
import imgpack.pipeline.*;
import imgpack.processors.*;
import imgpack.utils.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.concurrent.*;

@Command(
        name = "pack",
        description = "Transcode the images of every subdirectory of ROOT and pack each directory into <name>.zip.",
        mixinStandardHelpOptions = true
)
public class PackCommand implements Callable<Integer> {

    @Spec
    Model.CommandSpec spec;

    @Parameters(index = "0",
            arity = "0..1",
            description = "Root directory whose subdirectories are packed (default: current directory)")
    private File rootDir = new File(".");

    @Option(names = {"-o", "--output"},
            description = "Directory receiving the archives (default: ROOT)")
    private File outputDir;

    @Option(names = {"-f", "--format"},
            converter = TargetFormatConverter.class,
            description = "Output format: webp, jpg, jpeg, png or gif (default: webp)")
    private TargetFormat format = TargetFormat.WEBP;

    @Option(names = {"-q", "--quality"},
            description = "Output quality for lossy formats, 1-100 (default: ${DEFAULT-VALUE})")
    private float quality = PipelineConfig.DEFAULT_QUALITY;

    @Option(names = {"-w", "--max-width"},
            description = "Maximum width of the output images, 0 for no resizing (default: ${DEFAULT-VALUE})")
    private int maxWidth = PipelineConfig.DEFAULT_MAX_WIDTH;

    @Option(names = {"-t", "--threads"},
            description = "Number of transform workers and queue capacity (default: ${DEFAULT-VALUE})")
    private int threadCount = Runtime.getRuntime().availableProcessors();

    @Option(names = "--on-encode-failure",
            description = "What to archive when an image fails to encode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private EncodeFailurePolicy onEncodeFailure = EncodeFailurePolicy.PLACEHOLDER;

    @Option(names = "--entry-extension",
            negatable = true,
            description = "Name archive entries <name>.<format> (use --no-entry-extension for bare names)")
    private boolean entryExtension = true;

    @Option(names = "--verify-content",
            description = "Skip sources whose detected content type is not an image")
    private boolean verifyContent;

    @Option(names = {"-s", "--silent"},
            negatable = true,
            description = "Suppress progress output (use --no-silent to enable)")
    private boolean silent;

    @Override
    public Integer call() {
        if (threadCount < 1) {
            throw new ParameterException(spec.commandLine(), "Thread count must be at least 1, got " + threadCount);
        }
        PipelineConfig config;
        try {
            config = new PipelineConfig(format, quality, maxWidth, onEncodeFailure, entryExtension, verifyContent);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        ConsoleLog console = ConsoleLog.system(silent);
        return new PackProcessor(
                rootDir.toPath(),
                outputDir != null ? outputDir.toPath() : null,
                threadCount,
                config,
                new ImageIoCodec(),
                ShutdownSignal.installProcessWide(console),
                console
        ).run();
    }

}
