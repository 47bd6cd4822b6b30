package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.base.UIO;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.io.PointerReadableByteBufferFile;
import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import java.io.IOException;
import java.util.Arrays;

/**
 *
 * @author jonathan.colt
 */
public class ColumnFileFooter {

    final ColumnType type;
    final long rowCount;
    final int blockCount;
    final long indexFp;
    final long valuesSizeInBytes;
    final byte[] minValue;
    final byte[] maxValue;

    public ColumnFileFooter(ColumnType type,
        long rowCount,
        int blockCount,
        long indexFp,
        long valuesSizeInBytes,
        byte[] minValue,
        byte[] maxValue) {

        this.type = type;
        this.rowCount = rowCount;
        this.blockCount = blockCount;
        this.indexFp = indexFp;
        this.valuesSizeInBytes = valuesSizeInBytes;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public ColumnType type() {
        return type;
    }

    public long rowCount() {
        return rowCount;
    }

    public int blockCount() {
        return blockCount;
    }

    public long valuesSizeInBytes() {
        return valuesSizeInBytes;
    }

    public byte[] minValue() {
        return minValue;
    }

    public byte[] maxValue() {
        return maxValue;
    }

    @Override
    public String toString() {
        return "ColumnFileFooter{"
            + "type=" + type
            + ", rowCount=" + rowCount
            + ", blockCount=" + blockCount
            + ", indexFp=" + indexFp
            + ", valuesSizeInBytes=" + valuesSizeInBytes
            + ", minValue=" + Arrays.toString(minValue)
            + ", maxValue=" + Arrays.toString(maxValue)
            + '}';
    }

    int entryLength() {
        return 4 + 4 + 8 + 4 + 8 + 8 + UIO.byteArrayLength(minValue) + UIO.byteArrayLength(maxValue) + 4;
    }

    public void write(IAppendOnly writeable) throws IOException {
        int entryLength = entryLength();
        writeable.appendInt(entryLength);
        writeable.appendInt(type.ordinal());
        writeable.appendLong(rowCount);
        writeable.appendInt(blockCount);
        writeable.appendLong(indexFp);
        writeable.appendLong(valuesSizeInBytes);
        UIO.writeByteArray(writeable, minValue);
        UIO.writeByteArray(writeable, maxValue);
        writeable.appendInt(entryLength);
    }

    static ColumnFileFooter read(PointerReadableByteBufferFile readable, long offset) throws IOException, RowsetCorruptedException {
        long initialOffset = offset;
        int entryLength = readable.readInt(offset);
        offset += 4;
        ColumnType type = ColumnType.fromOrdinal(readable.readInt(offset));
        offset += 4;
        long rowCount = readable.readLong(offset);
        offset += 8;
        int blockCount = readable.readInt(offset);
        offset += 4;
        long indexFp = readable.readLong(offset);
        offset += 8;
        long valuesSizeInBytes = readable.readLong(offset);
        offset += 8;

        int minValueLength = readable.readInt(offset);
        offset += 4;
        byte[] minValue = readByteArray(readable, offset, minValueLength, entryLength);
        offset += Math.max(0, minValueLength);

        int maxValueLength = readable.readInt(offset);
        offset += 4;
        byte[] maxValue = readByteArray(readable, offset, maxValueLength, entryLength);
        offset += Math.max(0, maxValueLength);

        if (entryLength != (offset - initialOffset) + 4) {
            throw new RowsetCorruptedException("Encountered footer length corruption. Declared " + entryLength + " but read " + ((offset - initialOffset) + 4));
        }
        int el = readable.readInt(offset);
        if (el != entryLength) {
            throw new RowsetCorruptedException("Encountered length corruption. " + el + " vs " + entryLength);
        }
        if (rowCount < 0 || blockCount < 0 || indexFp < 0) {
            throw new RowsetCorruptedException("Encountered footer corruption. rowCount:" + rowCount + " blockCount:" + blockCount + " indexFp:" + indexFp);
        }
        return new ColumnFileFooter(type, rowCount, blockCount, indexFp, valuesSizeInBytes, minValue, maxValue);
    }

    static byte[] readByteArray(PointerReadableByteBufferFile readable, long offset, int length, int entryLength) throws IOException,
        RowsetCorruptedException {
        if (length == -1) {
            return null;
        }
        if (length < -1 || length > entryLength) {
            throw new RowsetCorruptedException("Encountered value length corruption. length:" + length + " within entry of " + entryLength);
        }
        byte[] bytes = new byte[length];
        readable.read(offset, bytes, 0, length);
        return bytes;
    }

}
