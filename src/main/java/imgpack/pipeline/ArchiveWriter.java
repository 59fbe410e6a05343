package imgpack.pipeline;

import java.io.*;
import java.nio.file.*;
import java.util.zip.*;

/**
 * Streaming zip archive for one unit of work. Writes and the final close are serialized, so an
 * interrupt closing the archive never cuts an entry in half. Closed exactly once.
 */
public final class ArchiveWriter implements Closeable {

    private final Path path;
    private final ZipOutputStream zip;
    private boolean closed;
    private int entries;

    private ArchiveWriter(Path path, OutputStream out) {
        this.path = path;
        this.zip = new ZipOutputStream(new BufferedOutputStream(out));
    }

    /** Creates (or truncates) the archive file. */
    public static ArchiveWriter create(Path path) throws IOException {
        return new ArchiveWriter(path, Files.newOutputStream(path));
    }

    /**
     * Adds one entry holding {@code data}.
     *
     * @return false when the archive is already closed and nothing was written
     * @throws IOException when the entry cannot be created or written, e.g. a duplicate name
     */
    public synchronized boolean write(String entryName, byte[] data) throws IOException {
        if (closed) return false;
        zip.putNextEntry(new ZipEntry(entryName));
        zip.write(data);
        zip.closeEntry();
        entries++;
        return true;
    }

    /**
     * Flushes and closes the archive.
     *
     * @return true if this call closed it, false if it was closed before
     */
    public synchronized boolean finish() throws IOException {
        if (closed) return false;
        closed = true;
        zip.flush();
        zip.close();
        return true;
    }

    @Override
    public void close() throws IOException {
        finish();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int entries() {
        return entries;
    }

    public Path path() {
        return path;
    }
}
