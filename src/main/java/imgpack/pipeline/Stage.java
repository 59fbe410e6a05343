package imgpack.pipeline;

/**
 * One pull-transform-push step. A stage receives items one at a time and emits zero or
 * more results for each. Implementations handle their own per-item failures.
 */
@FunctionalInterface
public interface Stage<I, O> {

    void process(I item, Emitter<O> out) throws InterruptedException;

    /** Feeds every result of this stage into {@code next}. */
    default <R> Stage<I, R> andThen(Stage<O, R> next) {
        return (item, out) -> process(item, result -> next.process(result, out));
    }
}
