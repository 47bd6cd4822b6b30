package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.core.api.ColumnBlock;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.IOStatistics;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.io.IOException;
import java.util.List;

/**
 * A cursor over one column file. Positions by ordinal or by key, then reads the blocks covering a batch of rows on
 * demand. Not thread safe.
 *
 * @author jonathan.colt
 */
public class ColumnFileIterator {

    private final ColumnFileReader reader;
    private final BlockIndex index;
    private final ColumnType type;
    private final long rowCount;

    private long currentOrdinal;
    private int preparedCount;
    private List<DecodedBlock> prepared = Lists.newArrayList();
    private DecodedBlock lastLoaded;

    private long blocksRead;
    private long bytesRead;

    ColumnFileIterator(ColumnFileReader reader) {
        this.reader = reader;
        this.index = reader.index();
        this.type = reader.type();
        this.rowCount = reader.rowCount();
    }

    public ColumnType type() {
        return type;
    }

    public long currentOrdinal() {
        return currentOrdinal;
    }

    public int preparedCount() {
        return preparedCount;
    }

    /**
     * Positions at {@code ordinal}, which may equal the row count to position past the last row. Reads nothing.
     */
    public void seekToOrdinal(long ordinal) {
        Preconditions.checkArgument(ordinal >= 0 && ordinal <= rowCount, "Ordinal %s is out of range [0, %s]", ordinal, rowCount);
        currentOrdinal = ordinal;
        preparedCount = 0;
    }

    /**
     * Positions at the first row whose value is at or after {@code key}.
     *
     * @return true when the value at the new position equals {@code key}
     */
    public boolean seekAtOrAfter(Object key) throws IOException, RowsetCorruptedException {
        type.checkValue(key);
        long ordinal = lowerBoundOrdinal(key, false);
        seekToOrdinal(ordinal);
        if (ordinal == rowCount) {
            return false;
        }
        DecodedBlock block = load(index.blockForOrdinal(ordinal));
        return type.compareAt(block.values, (int) (ordinal - block.firstOrdinal), key) == 0;
    }

    /**
     * Requires the column to be in ascending order.
     *
     * @return the first ordinal whose value is at or after {@code key} (strictly after when {@code exclusive}), or
     * the row count when there is none
     */
    public long lowerBoundOrdinal(Object key, boolean exclusive) throws IOException, RowsetCorruptedException {
        type.checkValue(key);
        int blockIndex = index.firstBlockEndingAtOrAfter(type, key, exclusive);
        if (blockIndex >= index.blockCount()) {
            return rowCount;
        }
        DecodedBlock block = load(blockIndex);
        int low = 0;
        int high = block.rowCount;
        while (low < high) {
            int mid = (low + high) >>> 1;
            int c = type.compareAt(block.values, mid, key);
            if (c < 0 || (exclusive && c == 0)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return block.firstOrdinal + low;
    }

    /**
     * Loads the blocks covering {@code [currentOrdinal, currentOrdinal + count)}.
     *
     * @return the number of rows prepared, less than {@code count} only at the end of the column
     */
    public int prepareBatch(int count) throws IOException, RowsetCorruptedException {
        Preconditions.checkArgument(count >= 0, "Negative batch size:%s", count);
        int actual = (int) Math.min(count, rowCount - currentOrdinal);
        List<DecodedBlock> blocks = Lists.newArrayList();
        if (actual > 0) {
            int first = index.blockForOrdinal(currentOrdinal);
            int last = index.blockForOrdinal(currentOrdinal + actual - 1);
            for (int b = first; b <= last; b++) {
                blocks.add(load(b));
            }
        }
        prepared = blocks;
        preparedCount = actual;
        return actual;
    }

    /**
     * Replaces the contents of {@code dst} with the first {@code count} prepared values.
     */
    public void scan(ColumnBlock dst, int count) {
        Preconditions.checkArgument(dst.type() == type, "Destination holds %s but column is %s", dst.type(), type);
        Preconditions.checkArgument(count >= 0 && count <= preparedCount, "Cannot scan %s of %s prepared rows", count, preparedCount);
        Preconditions.checkArgument(count <= dst.capacity(), "Destination capacity %s is less than %s", dst.capacity(), count);
        dst.reset();
        int copied = 0;
        for (DecodedBlock block : prepared) {
            if (copied == count) {
                break;
            }
            int srcOffset = (int) (currentOrdinal + copied - block.firstOrdinal);
            int n = Math.min(block.rowCount - srcOffset, count - copied);
            dst.copyFrom(block.values, srcOffset, copied, n);
            copied += n;
        }
    }

    /**
     * Advances past the prepared rows.
     */
    public void finishBatch() {
        currentOrdinal += preparedCount;
        preparedCount = 0;
        prepared = Lists.newArrayList();
    }

    public IOStatistics ioStatistics() {
        return new IOStatistics(blocksRead, bytesRead);
    }

    private DecodedBlock load(int blockIndex) throws IOException, RowsetCorruptedException {
        if (lastLoaded != null && lastLoaded.blockIndex == blockIndex) {
            return lastLoaded;
        }
        for (DecodedBlock block : prepared) {
            if (block.blockIndex == blockIndex) {
                lastLoaded = block;
                return block;
            }
        }
        DecodedBlock block = reader.readBlock(blockIndex);
        blocksRead++;
        bytesRead += block.bytesOnDisk;
        lastLoaded = block;
        return block;
    }

    @Override
    public String toString() {
        return "ColumnFileIterator{"
            + "file=" + reader.name()
            + ", currentOrdinal=" + currentOrdinal
            + ", preparedCount=" + preparedCount
            + ", blocksRead=" + blocksRead
            + '}';
    }
}
