package com.github.jnthnclt.os.rowset.core.guts;

import com.github.jnthnclt.os.rowset.core.RowsetStats;
import com.github.jnthnclt.os.rowset.core.api.ColumnBlock;
import com.github.jnthnclt.os.rowset.core.api.ColumnRangePredicate;
import com.github.jnthnclt.os.rowset.core.api.ColumnSchema;
import com.github.jnthnclt.os.rowset.core.api.ColumnwiseIterator;
import com.github.jnthnclt.os.rowset.core.api.IOStatistics;
import com.github.jnthnclt.os.rowset.core.api.ScanSpec;
import com.github.jnthnclt.os.rowset.core.api.Schema;
import com.github.jnthnclt.os.rowset.core.api.SelectionVector;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetSchemaException;
import com.github.jnthnclt.os.rowset.core.cfile.ColumnFileIterator;
import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.io.IOException;
import java.util.List;

/**
 * Scans a projection of a {@link ColumnFileSet} one batch at a time.
 *
 * Key range predicates are turned into an inclusive ordinal range {@code [lowerBound, upperBound]} during init.
 * Columns are only read when they are materialized, so a column the caller never asks for costs no I/O.
 * Not thread safe.
 *
 * @author jonathan.colt
 */
public class ColumnFileSetIterator implements ColumnwiseIterator {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    private final ColumnFileSet base;
    private final Schema projection;
    private final RowsetStats stats;
    private final long rowCount;

    private final ColumnFileIterator[] columnIterators;
    private final boolean[] columnsPrepared;
    private int[] projectionMapping;
    private ColumnFileIterator keyIterator;

    private long lowerBound;
    private long upperBound;
    private long currentIndex;
    private int preparedCount;

    private boolean initialized;
    private boolean batchPrepared;
    private boolean closed;

    ColumnFileSetIterator(ColumnFileSet base, Schema projection, RowsetStats stats) {
        this.base = base;
        this.projection = Preconditions.checkNotNull(projection, "Iterator requires a projection");
        this.stats = stats;
        this.rowCount = base.countRows();
        int numColumns = base.schema().numColumns();
        this.columnIterators = new ColumnFileIterator[numColumns];
        this.columnsPrepared = new boolean[numColumns];
        this.lowerBound = 0;
        this.upperBound = rowCount - 1;
    }

    @Override
    public Schema schema() {
        return projection;
    }

    /**
     * Removes the predicates on the key column from {@code spec} and narrows the scan to the rows they select.
     *
     * @param spec may be null for a full scan
     */
    @Override
    public void init(ScanSpec spec) throws IOException, RowsetCorruptedException, RowsetSchemaException {
        Preconditions.checkState(!closed, "Iterator is closed");
        Preconditions.checkState(!initialized, "Iterator is already initialized");

        projectionMapping = mapProjection();
        keyIterator = base.newColumnIterator(0);
        if (spec != null) {
            pushdownKeyPredicates(spec);
        }
        if (lowerBound <= upperBound) {
            keyIterator.seekToOrdinal(lowerBound);
        }
        currentIndex = lowerBound;
        initialized = true;
        LOG.debug("Initialized scan of {} over ordinals [{}, {}] of {}", projection, lowerBound, upperBound, base);
    }

    private int[] mapProjection() throws RowsetSchemaException {
        Schema schema = base.schema();
        int[] mapping = new int[projection.numColumns()];
        for (int i = 0; i < mapping.length; i++) {
            ColumnSchema wanted = projection.column(i);
            int column = schema.findColumn(wanted.name);
            if (column < 0) {
                throw new RowsetSchemaException("Projected column " + wanted + " is not part of " + schema);
            }
            ColumnSchema found = schema.column(column);
            if (found.type != wanted.type) {
                throw new RowsetSchemaException("Projected column " + wanted + " does not match stored column " + found);
            }
            mapping[i] = column;
        }
        for (int i = 0; i < mapping.length; i++) {
            Preconditions.checkState(base.isColumnOpen(mapping[i]), "Column %s was not opened in %s", projection.column(i), base);
        }
        return mapping;
    }

    private void pushdownKeyPredicates(ScanSpec spec) throws IOException, RowsetCorruptedException {
        ColumnSchema key = base.schema().keyColumn();
        for (ColumnRangePredicate predicate : spec.predicates()) {
            if (predicate.column.equals(key.name)) {
                if (predicate.lower != null) {
                    key.type.checkValue(predicate.lower);
                }
                if (predicate.upper != null) {
                    key.type.checkValue(predicate.upper);
                }
            }
        }

        for (ColumnRangePredicate predicate : spec.removePredicatesOn(key.name)) {
            if (predicate.lower != null) {
                long lower = keyIterator.lowerBoundOrdinal(predicate.lower, !predicate.lowerInclusive);
                lowerBound = Math.max(lowerBound, lower);
            }
            if (predicate.upper != null) {
                // last ordinal at or before the bound is one less than the first ordinal after it
                long upper = keyIterator.lowerBoundOrdinal(predicate.upper, predicate.upperInclusive) - 1;
                upperBound = Math.min(upperBound, upper);
            }
            LOG.debug("Pushed down {} to ordinals [{}, {}]", predicate, lowerBound, upperBound);
        }
    }

    @Override
    public int prepareBatch(int requested) {
        Preconditions.checkState(initialized, "Iterator has not been initialized");
        Preconditions.checkState(!closed, "Iterator is closed");
        Preconditions.checkState(!batchPrepared, "The previous batch of %s rows was not finished", preparedCount);
        Preconditions.checkState(hasNext(), "Iterator is exhausted");
        Preconditions.checkArgument(requested > 0, "Batch size must be positive:%s", requested);

        preparedCount = (int) Math.min(requested, upperBound - currentIndex + 1);
        batchPrepared = true;
        stats.batches.increment();
        stats.rowsPrepared.add(preparedCount);
        return preparedCount;
    }

    @Override
    public void initializeSelectionVector(SelectionVector selectionVector) {
        checkBatchPrepared();
        selectionVector.resize(preparedCount);
        selectionVector.setAllTrue();
    }

    /**
     * Loads the blocks of one projected column for the current batch. Calling it again within the batch does nothing.
     */
    public void prepareColumn(int projectionIndex) throws IOException, RowsetCorruptedException {
        checkBatchPrepared();
        Preconditions.checkElementIndex(projectionIndex, projectionMapping.length, "projection index");
        int column = projectionMapping[projectionIndex];
        if (columnsPrepared[column]) {
            return;
        }
        ColumnFileIterator iterator = columnIterators[column];
        if (iterator == null) {
            iterator = base.newColumnIterator(column);
            columnIterators[column] = iterator;
        }
        iterator.seekToOrdinal(currentIndex);
        int prepared = iterator.prepareBatch(preparedCount);
        if (prepared != preparedCount) {
            throw new RowsetCorruptedException("Column " + base.schema().column(column) + " could only prepare " + prepared
                + " of " + preparedCount + " rows at ordinal " + currentIndex + " in " + base);
        }
        columnsPrepared[column] = true;
    }

    @Override
    public void materializeColumn(int projectionIndex, ColumnBlock dst) throws IOException, RowsetCorruptedException {
        checkBatchPrepared();
        Preconditions.checkElementIndex(projectionIndex, projectionMapping.length, "projection index");
        ColumnSchema columnSchema = projection.column(projectionIndex);
        Preconditions.checkArgument(dst.type() == columnSchema.type, "Block of %s cannot hold column %s", dst.type(), columnSchema);
        Preconditions.checkArgument(dst.capacity() >= preparedCount, "Block capacity %s is less than the batch of %s rows",
            dst.capacity(), preparedCount);

        prepareColumn(projectionIndex);
        columnIterators[projectionMapping[projectionIndex]].scan(dst, preparedCount);
        stats.columnsMaterialized.increment();
    }

    @Override
    public void finishBatch() {
        checkBatchPrepared();
        for (int column = 0; column < columnsPrepared.length; column++) {
            if (columnsPrepared[column]) {
                columnIterators[column].finishBatch();
                columnsPrepared[column] = false;
            }
        }
        currentIndex += preparedCount;
        preparedCount = 0;
        batchPrepared = false;
    }

    private void checkBatchPrepared() {
        Preconditions.checkState(!closed, "Iterator is closed");
        Preconditions.checkState(batchPrepared, "No batch has been prepared");
    }

    @Override
    public boolean hasNext() {
        return initialized && !closed && currentIndex <= upperBound;
    }

    @Override
    public List<IOStatistics> ioStatistics() {
        List<IOStatistics> ioStatistics = Lists.newArrayListWithCapacity(projection.numColumns());
        for (int i = 0; i < projection.numColumns(); i++) {
            ColumnFileIterator iterator = projectionMapping == null ? null : columnIterators[projectionMapping[i]];
            ioStatistics.add(iterator == null ? IOStatistics.ZERO : iterator.ioStatistics());
        }
        return ioStatistics;
    }

    /**
     * Reads done by the key cursor while translating predicates into ordinal bounds.
     */
    public IOStatistics keyIOStatistics() {
        return keyIterator == null ? IOStatistics.ZERO : keyIterator.ioStatistics();
    }

    public long lowerBoundIndex() {
        return lowerBound;
    }

    public long upperBoundIndex() {
        return upperBound;
    }

    public long currentIndex() {
        return currentIndex;
    }

    public int preparedCount() {
        return preparedCount;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            base.release();
        }
    }

    @Override
    public String toString() {
        return "ColumnFileSetIterator{"
            + "base=" + base
            + ", projection=" + projection
            + ", lowerBound=" + lowerBound
            + ", upperBound=" + upperBound
            + ", currentIndex=" + currentIndex
            + ", preparedCount=" + preparedCount
            + '}';
    }
}
