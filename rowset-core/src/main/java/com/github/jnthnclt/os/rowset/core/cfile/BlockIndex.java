package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.base.UIO;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.io.PointerReadableByteBufferFile;
import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Arrays;

/**
 * One entry per block: where it starts, its first ordinal, its row count and its last value. Lets a reader go from
 * an ordinal or a key to a block without touching any data block.
 *
 * @author jonathan.colt
 */
public class BlockIndex {

    final long[] fps;
    final long[] firstOrdinals;
    final int[] rowCounts;
    final byte[][] lastValues;

    private Object decodedLastValues; // lazily decoded for key searches
    private ColumnType decodedType;

    public BlockIndex(long[] fps, long[] firstOrdinals, int[] rowCounts, byte[][] lastValues) {
        Preconditions.checkArgument(fps.length == firstOrdinals.length && fps.length == rowCounts.length && fps.length == lastValues.length,
            "block index misalignment, %s %s %s %s", fps.length, firstOrdinals.length, rowCounts.length, lastValues.length);
        this.fps = fps;
        this.firstOrdinals = firstOrdinals;
        this.rowCounts = rowCounts;
        this.lastValues = lastValues;
    }

    public int blockCount() {
        return fps.length;
    }

    /**
     * @return the block holding {@code ordinal}, the ordinal must be in range
     */
    public int blockForOrdinal(long ordinal) {
        int index = Arrays.binarySearch(firstOrdinals, ordinal);
        if (index >= 0) {
            return index;
        }
        return -(index + 1) - 1;
    }

    /**
     * @return the first block whose last value is at or after {@code key} (strictly after when {@code exclusive}), or
     * {@link #blockCount()} when every value sorts before it
     */
    public int firstBlockEndingAtOrAfter(ColumnType type, Object key, boolean exclusive) throws RowsetCorruptedException {
        Object lastKeys = decodedLastValues(type);
        int low = 0;
        int high = fps.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            int c = type.compareAt(lastKeys, mid, key);
            if (c < 0 || (exclusive && c == 0)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private synchronized Object decodedLastValues(ColumnType type) throws RowsetCorruptedException {
        if (decodedLastValues == null || decodedType != type) {
            Object values = type.newArray(lastValues.length);
            for (int i = 0; i < lastValues.length; i++) {
                type.set(values, i, type.decodeKey(lastValues[i]));
            }
            decodedLastValues = values;
            decodedType = type;
        }
        return decodedLastValues;
    }

    int entryLength() {
        int entryLength = 4 + 4;
        for (byte[] lastValue : lastValues) {
            entryLength += 8 + 8 + 4 + UIO.byteArrayLength(lastValue);
        }
        return entryLength + 4;
    }

    public void write(IAppendOnly writeable) throws IOException {
        int entryLength = entryLength();
        writeable.appendInt(entryLength);
        writeable.appendInt(fps.length);
        for (int i = 0; i < fps.length; i++) {
            writeable.appendLong(fps[i]);
            writeable.appendLong(firstOrdinals[i]);
            writeable.appendInt(rowCounts[i]);
            UIO.writeByteArray(writeable, lastValues[i]);
        }
        writeable.appendInt(entryLength);
    }

    static BlockIndex read(PointerReadableByteBufferFile readable, long offset) throws IOException, RowsetCorruptedException {
        long initialOffset = offset;
        int entryLength = readable.readInt(offset);
        offset += 4;
        int blockCount = readable.readInt(offset);
        offset += 4;
        if (entryLength < 12 || blockCount < 0 || blockCount > (entryLength - 12) / (8 + 8 + 4 + 4)) {
            throw new RowsetCorruptedException("Encountered block index corruption. entryLength:" + entryLength + " blockCount:" + blockCount);
        }
        long[] fps = new long[blockCount];
        long[] firstOrdinals = new long[blockCount];
        int[] rowCounts = new int[blockCount];
        byte[][] lastValues = new byte[blockCount][];
        for (int i = 0; i < blockCount; i++) {
            fps[i] = readable.readLong(offset);
            offset += 8;
            firstOrdinals[i] = readable.readLong(offset);
            offset += 8;
            rowCounts[i] = readable.readInt(offset);
            offset += 4;
            int lastValueLength = readable.readInt(offset);
            offset += 4;
            lastValues[i] = ColumnFileFooter.readByteArray(readable, offset, lastValueLength, entryLength);
            offset += Math.max(0, lastValueLength);
        }
        if (entryLength != (offset - initialOffset) + 4) {
            throw new RowsetCorruptedException("Encountered block index length corruption. Declared " + entryLength
                + " but read " + ((offset - initialOffset) + 4));
        }
        int el = readable.readInt(offset);
        if (el != entryLength) {
            throw new RowsetCorruptedException("Encountered length corruption. " + el + " vs " + entryLength);
        }
        return new BlockIndex(fps, firstOrdinals, rowCounts, lastValues);
    }

    @Override
    public String toString() {
        return "BlockIndex{"
            + "fps=" + Arrays.toString(fps)
            + ", firstOrdinals=" + Arrays.toString(firstOrdinals)
            + ", rowCounts=" + Arrays.toString(rowCounts)
            + '}';
    }
}
