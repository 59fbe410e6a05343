package imgpack.processors;

// A command's unit of work, returning the process exit code.
public interface Processor {
    int run();
}
