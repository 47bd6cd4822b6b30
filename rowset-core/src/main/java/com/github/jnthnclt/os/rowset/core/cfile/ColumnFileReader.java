package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.base.BolBuffer;
import com.github.jnthnclt.os.rowset.core.RowsetStats;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.io.PointerReadableByteBufferFile;
import com.github.jnthnclt.os.rowset.core.io.ReadOnlyFile;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;

/**
 * An opened column file. The footer and block index are read and validated on open, data blocks are only read by
 * {@link ColumnFileIterator}s.
 *
 * @author jonathan.colt
 */
public class ColumnFileReader {

    private final ReadOnlyFile readOnlyFile;
    private final PointerReadableByteBufferFile readable;
    private final RowsetStats stats;
    private final ColumnFileFooter footer;
    private final BlockIndex index;

    private ColumnFileReader(ReadOnlyFile readOnlyFile,
        PointerReadableByteBufferFile readable,
        RowsetStats stats,
        ColumnFileFooter footer,
        BlockIndex index) {
        this.readOnlyFile = readOnlyFile;
        this.readable = readable;
        this.stats = stats;
        this.footer = footer;
        this.index = index;
    }

    public static ColumnFileReader open(File file, long bufferSegmentSize, RowsetStats stats) throws IOException, RowsetCorruptedException {
        ReadOnlyFile readOnlyFile = new ReadOnlyFile(file);
        try {
            PointerReadableByteBufferFile readable = readOnlyFile.pointerReadable(bufferSegmentSize);
            ColumnFileFooter footer = readFooter(readOnlyFile, readable);
            BlockIndex index = readIndex(readOnlyFile, readable, footer);
            return new ColumnFileReader(readOnlyFile, readable, stats, footer, index);
        } catch (EOFException x) {
            readOnlyFile.close();
            throw new RowsetCorruptedException("Truncated column file:" + file, x);
        } catch (IOException | RowsetCorruptedException | RuntimeException x) {
            readOnlyFile.close();
            throw x;
        }
    }

    private static ColumnFileFooter readFooter(ReadOnlyFile readOnlyFile, PointerReadableByteBufferFile readable) throws IOException,
        RowsetCorruptedException {
        long length = readable.length();
        if (length == 0) {
            throw new RowsetCorruptedException("Trying to open a column file with an empty file. " + readOnlyFile.getFileName());
        }
        long seekTo = length - 4;
        seekToBoundsCheck(readOnlyFile, seekTo, length);
        int footerLength = readable.readInt(seekTo);
        seekTo = length - (1 + (long) footerLength);
        seekToBoundsCheck(readOnlyFile, seekTo, length);

        int type = readable.read(seekTo);
        seekTo++;
        if (type != ColumnFileWriter.FOOTER) {
            throw new RowsetCorruptedException("Footer Corruption! Found " + type + " expected " + ColumnFileWriter.FOOTER
                + " within file:" + readOnlyFile.getFileName() + " length:" + length);
        }
        ColumnFileFooter footer = ColumnFileFooter.read(readable, seekTo);
        if (footer.indexFp >= length - (1 + (long) footerLength)) {
            throw new RowsetCorruptedException("Footer Corruption! index at " + footer.indexFp + " is not before the footer within file:"
                + readOnlyFile.getFileName());
        }
        return footer;
    }

    private static BlockIndex readIndex(ReadOnlyFile readOnlyFile,
        PointerReadableByteBufferFile readable,
        ColumnFileFooter footer) throws IOException, RowsetCorruptedException {

        long length = readable.length();
        long footerFp = length - (1 + (long) footer.entryLength());
        int type = readable.read(footer.indexFp);
        if (type != ColumnFileWriter.INDEX) {
            throw new RowsetCorruptedException("Index Corruption! Found " + type + " expected " + ColumnFileWriter.INDEX
                + " within file:" + readOnlyFile.getFileName() + " at:" + footer.indexFp);
        }
        BlockIndex index = BlockIndex.read(readable, footer.indexFp + 1);
        if (footer.indexFp + 1 + index.entryLength() != footerFp) {
            throw new RowsetCorruptedException("Index Corruption! Index ends at " + (footer.indexFp + 1 + index.entryLength())
                + " but footer starts at " + footerFp + " within file:" + readOnlyFile.getFileName());
        }
        if (index.blockCount() != footer.blockCount) {
            throw new RowsetCorruptedException("Index Corruption! Found " + index.blockCount() + " blocks expected " + footer.blockCount
                + " within file:" + readOnlyFile.getFileName());
        }

        long expectedOrdinal = 0;
        long lastFp = -1;
        for (int i = 0; i < index.blockCount(); i++) {
            if (index.firstOrdinals[i] != expectedOrdinal || index.rowCounts[i] <= 0) {
                throw new RowsetCorruptedException("Index Corruption! Block " + i + " starts at ordinal " + index.firstOrdinals[i]
                    + " with " + index.rowCounts[i] + " rows, expected ordinal " + expectedOrdinal + " within file:" + readOnlyFile.getFileName());
            }
            if (index.fps[i] <= lastFp || index.fps[i] >= footer.indexFp) {
                throw new RowsetCorruptedException("Index Corruption! Block " + i + " at fp " + index.fps[i] + " is out of order within file:"
                    + readOnlyFile.getFileName());
            }
            expectedOrdinal += index.rowCounts[i];
            lastFp = index.fps[i];
        }
        if (expectedOrdinal != footer.rowCount) {
            throw new RowsetCorruptedException("Index Corruption! Blocks hold " + expectedOrdinal + " rows but footer declares "
                + footer.rowCount + " within file:" + readOnlyFile.getFileName());
        }
        return index;
    }

    private static void seekToBoundsCheck(ReadOnlyFile readOnlyFile, long seekTo, long length) throws RowsetCorruptedException {
        if (seekTo < 0 || seekTo >= length) {
            throw new RowsetCorruptedException(
                "Corruption! trying to seek to: " + seekTo + " within file:" + readOnlyFile.getFileName() + " length:" + length);
        }
    }

    /**
     * Reads, validates and decodes one data block.
     */
    DecodedBlock readBlock(int blockIndex) throws IOException, RowsetCorruptedException {
        long fp = index.fps[blockIndex];
        long end = blockIndex + 1 < index.blockCount() ? index.fps[blockIndex + 1] : footer.indexFp;
        int expectedRowCount = index.rowCounts[blockIndex];

        int type = readable.read(fp);
        if (type != ColumnFileWriter.BLOCK) {
            throw new RowsetCorruptedException("Block Corruption! Found " + type + " expected " + ColumnFileWriter.BLOCK
                + " for block " + blockIndex + " at fp:" + fp + " within file:" + readOnlyFile.getFileName());
        }
        int payloadLength = readable.readInt(fp + 1);
        int rowCount = readable.readInt(fp + 1 + 4);
        if (rowCount != expectedRowCount) {
            throw new RowsetCorruptedException("Block Corruption! Block " + blockIndex + " holds " + rowCount + " rows but index declares "
                + expectedRowCount + " within file:" + readOnlyFile.getFileName());
        }
        if (payloadLength < 0 || fp + 1 + 4 + 4 + payloadLength != end) {
            throw new RowsetCorruptedException("Block Corruption! Block " + blockIndex + " declares a payload of " + payloadLength
                + " bytes but spans " + (end - fp) + " bytes within file:" + readOnlyFile.getFileName());
        }

        BolBuffer payload = readable.sliceIntoBuffer(fp + 1 + 4 + 4, payloadLength, new BolBuffer());
        ColumnType columnType = footer.type;
        Object values = columnType.newArray(rowCount);
        int offset = 0;
        for (int i = 0; i < rowCount; i++) {
            offset += columnType.read(payload, offset, values, i);
        }
        if (offset != payloadLength) {
            throw new RowsetCorruptedException("Block Corruption! Block " + blockIndex + " decoded " + offset + " of " + payloadLength
                + " payload bytes within file:" + readOnlyFile.getFileName());
        }

        long onDisk = end - fp;
        stats.blocksRead.increment();
        stats.bytesRead.add(onDisk);
        return new DecodedBlock(blockIndex, index.firstOrdinals[blockIndex], rowCount, values, onDisk);
    }

    public ColumnFileIterator newIterator() {
        return new ColumnFileIterator(this);
    }

    public long rowCount() {
        return footer.rowCount;
    }

    public ColumnType type() {
        return footer.type;
    }

    public long sizeInBytes() {
        return readOnlyFile.length();
    }

    public ColumnFileFooter footer() {
        return footer;
    }

    public BlockIndex index() {
        return index;
    }

    public String name() {
        return readOnlyFile.getFileName();
    }

    public void close() throws IOException {
        readOnlyFile.close();
    }

    @Override
    public String toString() {
        return "ColumnFileReader{" + "file=" + readOnlyFile + ", footer=" + footer + '}';
    }
}
