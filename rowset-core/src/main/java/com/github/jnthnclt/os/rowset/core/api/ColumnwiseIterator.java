package com.github.jnthnclt.os.rowset.core.api;

import java.util.List;

/**
 * Batched, column at a time iteration over a projection.
 *
 * A scan is {@link #init(ScanSpec)} followed by rounds of {@link #prepareBatch(int)}, any number of
 * {@link #materializeColumn(int, ColumnBlock)} calls and {@link #finishBatch()} until {@link #hasNext()} is false.
 * Implementations are single threaded. Always {@link #close()} when done.
 *
 * @author jonathan.colt
 */
public interface ColumnwiseIterator extends AutoCloseable {

    Schema schema();

    void init(ScanSpec spec) throws Exception;

    /**
     * @return how many rows the batch actually holds, never more than requested
     */
    int prepareBatch(int requested) throws Exception;

    void initializeSelectionVector(SelectionVector selectionVector);

    void materializeColumn(int projectionIndex, ColumnBlock dst) throws Exception;

    void finishBatch() throws Exception;

    boolean hasNext();

    /**
     * @return one entry per projection column
     */
    List<IOStatistics> ioStatistics();

    @Override
    void close();
}
