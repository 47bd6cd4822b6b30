package com.github.jnthnclt.os.rowset.core.io;

import com.github.jnthnclt.os.rowset.base.BolBuffer;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetClosedException;
import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import com.google.common.io.CountingOutputStream;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A file that only grows. Each appender writes through its own buffered stream opened in append mode.
 *
 * @author jonathan.colt
 */
public class AppendOnlyFile {

    private final File file;
    private final FileOutputStream out;
    private final long initialLength;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile long appenderBase;
    private volatile CountingOutputStream counting;

    public AppendOnlyFile(File file) throws IOException {
        this.file = file;
        this.out = new FileOutputStream(file, true);
        this.initialLength = file.length();
    }

    public File getFile() {
        return file;
    }

    /**
     * Only one appender may be in use at a time.
     */
    public IAppendOnly appender() throws IOException, RowsetClosedException {
        if (closed.get()) {
            throw new RowsetClosedException("Cannot get an appender from a file that is already closed. " + file);
        }
        long base = length();
        CountingOutputStream counter = new CountingOutputStream(new BufferedOutputStream(out, 8192));
        appenderBase = base;
        counting = counter;
        DataOutputStream writer = new DataOutputStream(counter);
        return new IAppendOnly() {
            @Override
            public void appendByte(byte b) throws IOException {
                writer.writeByte(b);
            }

            @Override
            public void appendInt(int i) throws IOException {
                writer.writeInt(i);
            }

            @Override
            public void appendLong(long l) throws IOException {
                writer.writeLong(l);
            }

            @Override
            public void append(byte[] b, int offset, int length) throws IOException {
                writer.write(b, offset, length);
            }

            @Override
            public void append(BolBuffer bolBuffer) throws IOException {
                if (bolBuffer.bb == null) {
                    writer.write(bolBuffer.bytes, bolBuffer.offset, bolBuffer.length);
                } else {
                    writer.write(bolBuffer.copy());
                }
            }

            @Override
            public void flush(boolean fsync) throws IOException {
                writer.flush();
                if (fsync) {
                    out.getFD().sync();
                }
            }

            @Override
            public void close() throws IOException {
                writer.flush();
            }

            @Override
            public long length() throws IOException {
                return getFilePointer();
            }

            @Override
            public long getFilePointer() throws IOException {
                return base + counter.getCount();
            }

        };
    }

    public void close() throws IOException {
        synchronized (closed) {
            if (closed.compareAndSet(false, true)) {
                out.close();
            }
        }
    }

    public long length() {
        CountingOutputStream counter = counting;
        return counter == null ? initialLength : appenderBase + counter.getCount();
    }

    @Override
    public String toString() {
        return "AppendOnlyFile{"
            + "fileName=" + file
            + ", length=" + length()
            + '}';
    }

}
