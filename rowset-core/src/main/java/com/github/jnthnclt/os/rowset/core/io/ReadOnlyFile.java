package com.github.jnthnclt.os.rowset.core.io;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * @author jonathan.colt
 */
public class ReadOnlyFile {

    private final File file;
    private final RandomAccessFile randomAccessFile;
    private final long size;

    private volatile PointerReadableByteBufferFile pointerReadable;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ReadOnlyFile(File file) throws IOException {
        this.file = file;
        this.randomAccessFile = new RandomAccessFile(file, "r");
        this.size = randomAccessFile.length();
    }

    public String getFileName() {
        return file.toString();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Maps the file on first call. Later calls return the same mapping whatever segment size they ask for.
     */
    public PointerReadableByteBufferFile pointerReadable(long bufferSegmentSize) throws IOException {
        PointerReadableByteBufferFile got = pointerReadable;
        if (got == null) {
            synchronized (closed) {
                if (closed.get()) {
                    throw new IOException("Cannot map " + file + " it is already closed.");
                }
                if (pointerReadable == null) {
                    pointerReadable = new PointerReadableByteBufferFile(bufferSegmentSize, file);
                }
                got = pointerReadable;
            }
        }
        return got;
    }

    @Override
    public String toString() {
        return "ReadOnlyFile{"
            + "fileName=" + file
            + ", size=" + size
            + '}';
    }

    public void close() throws IOException {
        synchronized (closed) {
            if (closed.compareAndSet(false, true)) {
                randomAccessFile.close();
                if (pointerReadable != null) {
                    pointerReadable.close();
                }
            }
        }
    }

    public long length() {
        return size;
    }
}
