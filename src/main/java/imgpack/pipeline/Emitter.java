package imgpack.pipeline;

// Downstream end of a stage: accepts one item, blocking while the receiver is full.
@FunctionalInterface
public interface Emitter<T> {
    void emit(T item) throws InterruptedException;
}
