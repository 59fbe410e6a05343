package imgpack.pipeline;

import java.util.*;
import java.util.concurrent.*;

/**
 * Bounded multi-producer, multi-consumer queue that can be closed. Producers block while it
 * is full; consumers block while it is empty and receive {@code null} once it is closed and
 * drained. {@link #close()} must only be called after every producer has finished.
 */
public final class HandOffQueue<T> implements Emitter<T> {

    // end-of-stream marker, items themselves are never null
    private final Optional<T> poisonPill = Optional.empty();

    private final BlockingQueue<Optional<T>> queue;
    private final int capacity;
    private volatile boolean closed;

    public HandOffQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void put(T item) throws InterruptedException {
        if (item == null) {
            throw new NullPointerException("item");
        }
        if (closed) {
            throw new IllegalStateException("Queue is closed");
        }
        queue.put(Optional.of(item));
    }

    @Override
    public void emit(T item) throws InterruptedException {
        put(item);
    }

    /** Next item, or {@code null} once the queue is closed and drained. */
    public T take() throws InterruptedException {
        Optional<T> next = queue.take();
        if (next.isEmpty()) {
            // leave the pill for the remaining consumers
            queue.put(poisonPill);
            return null;
        }
        return next.get();
    }

    /** Marks end-of-stream. Blocks while the queue is full, so consumers must still be running. */
    public void close() throws InterruptedException {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        queue.put(poisonPill);
    }

    public boolean isClosed() {
        return closed;
    }

    public int capacity() {
        return capacity;
    }

    /** Items waiting to be taken, never more than {@link #capacity()}. */
    public int size() {
        int size = queue.size();
        return closed && queue.contains(poisonPill) ? size - 1 : size;
    }
}
