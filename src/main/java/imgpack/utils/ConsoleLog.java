package imgpack.utils;

import java.io.*;

/**
 * Where the tool talks to the user: progress and summaries on {@code out},
 * problems on {@code err} with an {@code ERROR:} or {@code WARN:} prefix.
 * Silent mode mutes {@code out} only.
 */
public final class ConsoleLog {
    private final PrintStream out;
    private final PrintStream err;
    private final boolean silent;

    public ConsoleLog(PrintStream out, PrintStream err, boolean silent) {
        this.out = out;
        this.err = err;
        this.silent = silent;
    }

    public static ConsoleLog system(boolean silent) {
        return new ConsoleLog(System.out, System.err, silent);
    }

    public boolean silent() {
        return silent;
    }

    public PrintStream out() {
        return out;
    }

    public void info(String format, Object... args) {
        if (silent) return;
        out.printf(format, args);
        out.flush();
    }

    // printed even in silent mode
    public void notice(String format, Object... args) {
        out.printf(format, args);
        out.flush();
    }

    // leading newline so the message does not land on a half-drawn progress line
    public void error(String format, Object... args) {
        err.printf("%nERROR: " + format + "%n", args);
        err.flush();
    }

    public void warn(String format, Object... args) {
        err.printf("%nWARN: " + format + "%n", args);
        err.flush();
    }
}
