package imgpack.pipeline;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

// Daemon thread factory, pipeline threads must never keep the JVM alive.
final class NamedThreads implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    NamedThreads(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setDaemon(true);
        t.setName(prefix + "-" + counter.incrementAndGet());
        return t;
    }
}
