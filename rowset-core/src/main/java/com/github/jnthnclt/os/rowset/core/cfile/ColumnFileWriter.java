package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetClosedException;
import com.github.jnthnclt.os.rowset.core.io.AppendOnlyFile;
import com.github.jnthnclt.os.rowset.io.AppendableHeap;
import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one column as a run of blocks followed by a block index and a footer.
 *
 * @author jonathan.colt
 */
public class ColumnFileWriter {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    public static final byte BLOCK = 0;
    public static final byte INDEX = 1;
    public static final byte FOOTER = 2;

    private final AppendOnlyFile appendOnlyFile;
    private final ColumnType type;
    private final int rowsPerBlock;
    private final boolean strictlyAscending;

    private final AppendableHeap payload = new AppendableHeap(8192);
    private int rowsInBlock;
    private Object lastValue;
    private Object minValue;
    private Object maxValue;
    private long count;
    private long valuesSizeInBytes;

    private final List<Long> fps = new ArrayList<>();
    private final List<Long> firstOrdinals = new ArrayList<>();
    private final List<Integer> rowCounts = new ArrayList<>();
    private final List<byte[]> lastValues = new ArrayList<>();

    private IAppendOnly appendOnly;
    private boolean closed;

    /**
     * @param strictlyAscending rejects any value that does not sort after the previous one, required for key columns
     */
    public ColumnFileWriter(AppendOnlyFile appendOnlyFile, ColumnType type, int rowsPerBlock, boolean strictlyAscending) {
        Preconditions.checkArgument(rowsPerBlock > 0, "rowsPerBlock must be positive, %s", rowsPerBlock);
        this.appendOnlyFile = appendOnlyFile;
        this.type = type;
        this.rowsPerBlock = rowsPerBlock;
        this.strictlyAscending = strictlyAscending;
    }

    public void append(Object value) throws IOException, RowsetClosedException {
        Preconditions.checkState(!closed, "Cannot append to a closed column file %s", appendOnlyFile.getFile());
        type.checkValue(value);
        if (strictlyAscending && lastValue != null && type.compare(lastValue, value) >= 0) {
            throw new IllegalArgumentException("Values must be strictly ascending but " + value + " follows " + lastValue);
        }
        if (appendOnly == null) {
            appendOnly = appendOnlyFile.appender();
        }

        type.write(payload, value);
        rowsInBlock++;
        count++;
        lastValue = value;
        if (minValue == null || type.compare(value, minValue) < 0) {
            minValue = value;
        }
        if (maxValue == null || type.compare(value, maxValue) > 0) {
            maxValue = value;
        }

        if (rowsInBlock >= rowsPerBlock) {
            flushBlock();
        }
    }

    public long rowCount() {
        return count;
    }

    private void flushBlock() throws IOException {
        long fp = appendOnly.getFilePointer();
        int payloadLength = (int) payload.length();

        fps.add(fp);
        firstOrdinals.add(count - rowsInBlock);
        rowCounts.add(rowsInBlock);
        lastValues.add(type.encodeKey(lastValue));

        appendOnly.appendByte(BLOCK);
        appendOnly.appendInt(payloadLength);
        appendOnly.appendInt(rowsInBlock);
        appendOnly.append(payload.leakBytes(), 0, payloadLength);

        valuesSizeInBytes += payloadLength;
        payload.reset();
        rowsInBlock = 0;
    }

    public void closeAppendable(boolean fsync) throws IOException, RowsetClosedException {
        Preconditions.checkState(!closed, "Column file %s was already closed", appendOnlyFile.getFile());
        try {
            if (appendOnly == null) {
                appendOnly = appendOnlyFile.appender();
            }
            if (rowsInBlock > 0) {
                flushBlock();
            }

            long indexFp = appendOnly.getFilePointer();
            BlockIndex blockIndex = new BlockIndex(Longs.toArray(fps),
                Longs.toArray(firstOrdinals),
                Ints.toArray(rowCounts),
                lastValues.toArray(new byte[0][]));

            AppendableHeap appendableHeap = new AppendableHeap(8192);
            appendableHeap.appendByte(INDEX);
            blockIndex.write(appendableHeap);

            appendableHeap.appendByte(FOOTER);
            ColumnFileFooter footer = new ColumnFileFooter(type,
                count,
                fps.size(),
                indexFp,
                valuesSizeInBytes,
                minValue == null ? null : type.encodeKey(minValue),
                maxValue == null ? null : type.encodeKey(maxValue));
            footer.write(appendableHeap);

            appendOnly.append(appendableHeap.leakBytes(), 0, (int) appendableHeap.length());
            appendOnly.flush(fsync);

            LOG.debug("Wrote {} rows in {} blocks to {}", count, fps.size(), appendOnlyFile.getFile());
        } finally {
            closed = true;
            if (appendOnly != null) {
                appendOnly.close();
            }
            appendOnlyFile.close();
        }
    }

}
