package com.github.jnthnclt.os.rowset.core.guts;

import com.github.jnthnclt.os.rowset.core.RowsetConfig;
import com.github.jnthnclt.os.rowset.core.RowsetEnvironment;
import com.github.jnthnclt.os.rowset.core.RowsetStats;
import com.github.jnthnclt.os.rowset.core.api.ColumnSchema;
import com.github.jnthnclt.os.rowset.core.api.RowsetBaseData;
import com.github.jnthnclt.os.rowset.core.api.RowsetKeyProbe;
import com.github.jnthnclt.os.rowset.core.api.Schema;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetClosedException;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.bloom.BloomFileReader;
import com.github.jnthnclt.os.rowset.core.cfile.ColumnFileIterator;
import com.github.jnthnclt.os.rowset.core.cfile.ColumnFileReader;
import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import com.google.common.base.Preconditions;
import java.io.File;
import java.io.IOException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The column files of one rowset directory plus its optional bloom filter.
 *
 * Opened exactly once, then shared by any number of concurrent lookups and iterators. Each of them holds a permit of
 * {@code hideABone} for as long as it touches the files, and closing waits for every permit to come back. Shares are
 * taken without queueing, so a thread that already holds an iterator can still run lookups while a close is pending.
 * Once a close or retire is pending no new iterators are handed out.
 *
 * @author jonathan.colt
 */
public class ColumnFileSet implements RowsetBaseData {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    private final RowsetEnvironment environment;
    private final File dir;
    private final Schema schema;
    private final ColumnFileReader[] readers;
    private volatile BloomFileReader bloomReader;

    private final Semaphore hideABone = new Semaphore(Short.MAX_VALUE, true);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private volatile boolean opened;
    private volatile boolean failed;
    private volatile boolean retiring;

    public ColumnFileSet(RowsetEnvironment environment, File dir, Schema schema) {
        this.environment = environment;
        this.dir = dir;
        this.schema = schema;
        this.readers = new ColumnFileReader[schema.numColumns()];
    }

    public void openAllColumns() throws IOException, RowsetCorruptedException {
        openColumns(schema.numColumns());
    }

    public void openKeyColumns() throws IOException, RowsetCorruptedException {
        openColumns(1);
    }

    private synchronized void openColumns(int count) throws IOException, RowsetCorruptedException {
        Preconditions.checkState(!failed, "%s failed to open and cannot be used", this);
        Preconditions.checkState(!opened, "%s is already open", this);

        RowsetConfig config = environment.config();
        RowsetStats stats = environment.stats();
        try {
            for (int i = 0; i < count; i++) {
                ColumnSchema columnSchema = schema.column(i);
                File columnFile = environment.columnFile(dir, i);
                readers[i] = ColumnFileReader.open(columnFile, config.bufferSegmentSize, stats);
                stats.columnsOpened.increment();
                if (readers[i].type() != columnSchema.type) {
                    throw new RowsetCorruptedException("Column " + columnSchema + " is stored as " + readers[i].type() + " in " + columnFile);
                }
            }

            long rowCount = readers[0].rowCount();
            for (int i = 1; i < count; i++) {
                if (readers[i].rowCount() != rowCount) {
                    throw new RowsetCorruptedException("Column " + schema.column(i) + " has " + readers[i].rowCount()
                        + " rows but key column " + schema.keyColumn() + " has " + rowCount + " in " + dir);
                }
            }

            File bloomFile = environment.bloomFile(dir);
            if (config.openBloomFilter && bloomFile.exists()) {
                bloomReader = BloomFileReader.open(bloomFile);
                stats.bloomFiltersOpened.increment();
            }

            opened = true;
            stats.open.increment();
            LOG.debug("Opened {} of {} columns with {} rows, bloom:{} in {}", count, schema.numColumns(), rowCount, bloomReader != null, dir);
        } catch (IOException | RowsetCorruptedException | RuntimeException x) {
            failed = true;
            LOG.inc("openFailed");
            LOG.error("Failed to open " + this, x);
            closeReaders(x);
            throw x;
        }
    }

    private void closeReaders(Exception cause) {
        for (int i = 0; i < readers.length; i++) {
            if (readers[i] != null) {
                try {
                    readers[i].close();
                } catch (IOException e) {
                    cause.addSuppressed(e);
                }
                readers[i] = null;
            }
        }
        bloomReader = null;
    }

    private void checkOpen() {
        Preconditions.checkState(!failed, "%s failed to open and cannot be used", this);
        Preconditions.checkState(opened, "%s has not been opened", this);
    }

    private void acquire() throws RowsetClosedException {
        checkOpen();
        // barges past a queued closer, which is waiting on permits this thread may already hold
        if (!hideABone.tryAcquire()) {
            throw new RowsetClosedException(this + " is closing.");
        }
        if (disposed.get()) {
            hideABone.release();
            throw new RowsetClosedException(this + " has already been closed.");
        }
    }

    void release() {
        hideABone.release();
    }

    @Override
    public Schema schema() {
        return schema;
    }

    public File dir() {
        return dir;
    }

    public boolean hasBloomFilter() {
        return bloomReader != null;
    }

    boolean isColumnOpen(int column) {
        return readers[column] != null;
    }

    @Override
    public long countRows() {
        checkOpen();
        return readers[0].rowCount();
    }

    /**
     * Sum of the sizes of the opened column files.
     */
    @Override
    public long estimateOnDiskSize() {
        checkOpen();
        long size = 0;
        for (ColumnFileReader reader : readers) {
            if (reader != null) {
                size += reader.sizeInBytes();
            }
        }
        return size;
    }

    @Override
    public long findRow(RowsetKeyProbe probe) throws IOException, RowsetCorruptedException, RowsetClosedException, InterruptedException {
        acquire();
        try {
            environment.stats().findRow.increment();
            return findRowShared(probe);
        } finally {
            release();
        }
    }

    @Override
    public boolean checkRowPresent(RowsetKeyProbe probe) throws IOException, RowsetCorruptedException, RowsetClosedException,
        InterruptedException {
        acquire();
        try {
            RowsetStats stats = environment.stats();
            stats.checkRowPresent.increment();
            BloomFileReader bloom = bloomReader;
            if (bloom != null) {
                stats.bloomProbes.increment();
                if (!bloom.checkKeyPresent(probe)) {
                    stats.bloomAbsent.increment();
                    return false;
                }
            }
            return findRowShared(probe) >= 0;
        } finally {
            release();
        }
    }

    private long findRowShared(RowsetKeyProbe probe) throws IOException, RowsetCorruptedException {
        ColumnSchema key = schema.keyColumn();
        Preconditions.checkArgument(probe.type() == key.type, "Probe of %s cannot search key column %s", probe.type(), key);
        ColumnFileIterator keyIterator = readers[0].newIterator();
        return keyIterator.seekAtOrAfter(probe.key()) ? keyIterator.currentOrdinal() : -1;
    }

    /**
     * The returned iterator holds a share of this set until it is closed.
     */
    @Override
    public ColumnFileSetIterator newIterator(Schema projection) throws RowsetClosedException, InterruptedException {
        if (retiring) {
            checkOpen();
            throw new RowsetClosedException(this + " has been retired.");
        }
        acquire();
        try {
            environment.stats().iterators.increment();
            return new ColumnFileSetIterator(this, projection, environment.stats());
        } catch (RuntimeException x) {
            release();
            throw x;
        }
    }

    ColumnFileIterator newColumnIterator(int column) {
        Preconditions.checkElementIndex(column, readers.length, "column");
        ColumnFileReader reader = readers[column];
        Preconditions.checkState(reader != null, "Column %s of %s was not opened", schema.column(column), this);
        return reader.newIterator();
    }

    /**
     * Blocks until every share has been returned, then closes the files.
     */
    public void close() throws IOException, InterruptedException {
        retiring = true;
        hideABone.acquire(Short.MAX_VALUE);
        try {
            dispose();
        } finally {
            hideABone.release(Short.MAX_VALUE);
        }
    }

    /**
     * Closes on the environment's destroy executor once every share has been returned.
     */
    public Future<Void> retire() {
        retiring = true;
        LOG.inc("retired");
        return environment.destroy().submit(() -> {
            close();
            return null;
        });
    }

    public boolean isClosed() {
        return disposed.get();
    }

    boolean isClosePending() {
        return hideABone.hasQueuedThreads();
    }

    private void dispose() throws IOException {
        if (disposed.compareAndSet(false, true)) {
            IOException failure = null;
            for (int i = 0; i < readers.length; i++) {
                if (readers[i] != null) {
                    try {
                        readers[i].close();
                    } catch (IOException e) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
            }
            bloomReader = null;
            if (opened) {
                environment.stats().closed.increment();
            }
            LOG.debug("Closed {}", this);
            if (failure != null) {
                throw failure;
            }
        }
    }

    @Override
    public String toString() {
        return "column file base data in " + dir;
    }
}
