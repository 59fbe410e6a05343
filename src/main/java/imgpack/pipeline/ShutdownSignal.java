package imgpack.pipeline;

import imgpack.utils.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;

/**
 * Process-wide reaction to SIGINT/SIGTERM. An archive is registered from its creation until
 * it has been finished; when the signal fires every registered archive is closed with what it
 * holds so far and the process halts. Create it once per process.
 */
public class ShutdownSignal {

    public static final int INTERRUPTED_EXIT_CODE = 0;

    private final Set<ArchiveWriter> active = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean triggered = new AtomicBoolean();
    private final ConsoleLog console;
    private final IntConsumer exit;

    public ShutdownSignal(ConsoleLog console, IntConsumer exit) {
        this.console = console;
        this.exit = exit;
    }

    /** Installs the JVM shutdown hook that fires this signal and halts with {@link #INTERRUPTED_EXIT_CODE}. */
    public static ShutdownSignal installProcessWide(ConsoleLog console) {
        ShutdownSignal signal = new ShutdownSignal(console, code -> Runtime.getRuntime().halt(code));
        Runtime.getRuntime().addShutdownHook(new Thread(signal::trigger, "imgpack-shutdown"));
        return signal;
    }

    public void register(ArchiveWriter archive) {
        active.add(archive);
    }

    public void unregister(ArchiveWriter archive) {
        active.remove(archive);
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    /**
     * Closes the registered archives and exits. A no-op when nothing is being archived, which
     * is the case for a normal JVM exit.
     */
    public void trigger() {
        if (!triggered.compareAndSet(false, true)) return;
        if (active.isEmpty()) return;

        console.notice("%nInterrupt signal received. Closing archive...%n");
        for (ArchiveWriter archive : List.copyOf(active)) {
            try {
                archive.finish();
            } catch (IOException e) {
                console.error("closing %s failed: %s", archive.path(), e.getMessage());
            }
        }
        active.clear();
        console.notice("Archive closed. Exiting...%n");
        exit.accept(INTERRUPTED_EXIT_CODE);
    }
}
