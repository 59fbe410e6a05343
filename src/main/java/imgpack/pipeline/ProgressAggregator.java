package imgpack.pipeline;

import imgpack.models.*;
import imgpack.utils.*;

import java.io.*;
import java.util.*;

/**
 * Running totals of one unit of work and the single rewriting progress line that shows them.
 * Not thread-safe: only the archive sink's consuming thread may call it.
 */
public class ProgressAggregator {
    public static final int BAR_WIDTH = 50;

    private static final String ANSI_CARRIAGE_RETURN = "\r";
    private static final String ANSI_ERASE_LINE      = "\u001B[2K";
    private static final String START_FORMAT    = "Processing %s%n";
    private static final String PROGRESS_FORMAT = "ratio %6.2f%% [%s] %6.2f%% %10s/%s";

    private final String unitName;
    private final PrintStream out;
    private final boolean silent;

    private int itemsProcessed;
    private int itemsExpected;
    private long totalOriginalBytes;
    private long totalEncodedBytes;

    public ProgressAggregator(String unitName, int itemsExpected, ConsoleLog console) {
        this(unitName, itemsExpected, console.out(), console.silent());
    }

    public ProgressAggregator(String unitName, int itemsExpected, PrintStream out, boolean silent) {
        if (itemsExpected < 0) {
            throw new IllegalArgumentException("Expected item count must not be negative");
        }
        this.unitName = unitName;
        this.itemsExpected = itemsExpected;
        this.out = out;
        this.silent = silent;
    }

    public void start() {
        if (silent) return;
        out.printf(START_FORMAT, unitName);
        out.flush();
    }

    public void record(long originalSize, long encodedSize) {
        if (itemsProcessed >= itemsExpected) {
            // directory grew after it was counted
            itemsExpected = itemsProcessed + 1;
        }
        itemsProcessed++;
        totalOriginalBytes += originalSize;
        totalEncodedBytes += encodedSize;
        render();
    }

    // an item that will never be recorded
    public void discount() {
        if (itemsExpected > itemsProcessed) {
            itemsExpected--;
        }
    }

    public void finish() {
        if (silent) return;
        out.println();
        out.flush();
    }

    public RunningTotals totals() {
        return new RunningTotals(itemsProcessed, itemsExpected, totalOriginalBytes, totalEncodedBytes);
    }

    public String progressLine() {
        RunningTotals t = totals();
        double percent = t.percentComplete();
        return String.format(Locale.ROOT, PROGRESS_FORMAT,
                t.compressionRatio(),
                bar(percent, BAR_WIDTH),
                percent,
                SizeUtils.humanReadable(totalEncodedBytes),
                SizeUtils.humanReadable(totalOriginalBytes));
    }

    private void render() {
        if (silent) return;
        out.print(ANSI_CARRIAGE_RETURN + ANSI_ERASE_LINE + progressLine());
        out.flush();
    }

    // "=====>     " sized to exactly width characters
    static String bar(double percent, int width) {
        int filled = (int) (Math.max(0, Math.min(100, percent)) / 100 * width);
        StringBuilder b = new StringBuilder(width);
        for (int i = 0; i < filled - 1; i++) {
            b.append('=');
        }
        if (filled > 0) {
            b.append('>');
        }
        while (b.length() < width) {
            b.append(' ');
        }
        return b.toString();
    }
}
