package imgpack.pipeline;

import imgpack.utils.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * Runs {@code concurrency} identical loops that take from {@code in}, hand each item to the
 * stage and let it emit into {@code out}. A loop ends when {@code in} is closed and drained.
 */
public final class WorkerPool<I, O> {

    private final String name;
    private final int concurrency;
    private final Stage<I, O> stage;
    private final HandOffQueue<I> in;
    private final Emitter<O> out;
    private final ConsoleLog console;
    private final AtomicInteger processed = new AtomicInteger();
    private final List<Future<Void>> loops = new ArrayList<>();
    private ExecutorService executor;

    public WorkerPool(String name, int concurrency, Stage<I, O> stage, HandOffQueue<I> in, Emitter<O> out, ConsoleLog console) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.name = name;
        this.concurrency = concurrency;
        this.stage = stage;
        this.in = in;
        this.out = out;
        this.console = console;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker pool " + name + " already started");
        }
        executor = Executors.newFixedThreadPool(concurrency, new NamedThreads(name));
        for (int i = 0; i < concurrency; i++) {
            loops.add(executor.submit(this::workerLoop));
        }
        executor.shutdown();
    }

    /** Blocks until every worker has seen the end of its input. A loop that died is reported. */
    public void awaitCompletion() throws InterruptedException {
        List<Future<Void>> running;
        synchronized (this) {
            if (executor == null) {
                throw new IllegalStateException("Worker pool " + name + " not started");
            }
            running = List.copyOf(loops);
        }
        for (Future<Void> loop : running) {
            try {
                loop.get();
            } catch (ExecutionException e) {
                console.error("%s: worker stopped: %s", name, e.getCause());
            } catch (CancellationException e) {
                console.error("%s: worker cancelled", name);
            }
        }
    }

    public void abort() {
        synchronized (this) {
            if (executor != null) executor.shutdownNow();
        }
    }

    public int processed() {
        return processed.get();
    }

    private Void workerLoop() throws InterruptedException {
        I item;
        while ((item = in.take()) != null) {
            try {
                stage.process(item, out);
            } catch (RuntimeException | Error e) {
                // a loop must outlive any single item
                console.error("%s: unexpected failure, item discarded: %s", Thread.currentThread().getName(), e);
            }
            processed.incrementAndGet();
        }
        return null;
    }
}
