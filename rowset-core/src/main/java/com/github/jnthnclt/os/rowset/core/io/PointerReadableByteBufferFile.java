package com.github.jnthnclt.os.rowset.core.io;

import com.github.jnthnclt.os.rowset.base.BolBuffer;
import com.github.jnthnclt.os.rowset.base.UIO;
import com.google.common.base.Preconditions;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileChannel.MapMode;

/**
 * Read only view of a file as a run of memory mapped segments. Segment sizes are powers of 2 so a position splits
 * into a segment index and a seek with a shift and a mask.
 */
public class PointerReadableByteBufferFile {

    public static final long MAX_BUFFER_SEGMENT_SIZE = UIO.chunkLength(30);

    private final long maxBufferSegmentSize;
    private final File file;
    private final long length;

    private final ByteBuffer[] bbs;

    private final int fShift;
    private final long fseekMask;

    public PointerReadableByteBufferFile(long maxBufferSegmentSize, File file) throws IOException {
        Preconditions.checkArgument(maxBufferSegmentSize > 0, "Buffer segment size must be positive but was %s", maxBufferSegmentSize);
        this.maxBufferSegmentSize = Math.min(UIO.chunkLength(UIO.chunkPower(maxBufferSegmentSize, 0)), MAX_BUFFER_SEGMENT_SIZE);
        this.file = file;

        // test power of 2
        if ((this.maxBufferSegmentSize & (this.maxBufferSegmentSize - 1)) == 0) {
            this.fShift = Long.numberOfTrailingZeros(this.maxBufferSegmentSize);
            this.fseekMask = this.maxBufferSegmentSize - 1;
        } else {
            throw new IllegalArgumentException("It's hard to ensure powers of 2");
        }
        this.length = file.length();
        int filerIndex = (int) (length >> fShift);
        long filerSeek = length & fseekMask;

        int newLength = filerIndex + 1;
        ByteBuffer[] newFilers = new ByteBuffer[newLength];
        for (int n = 0; n < newLength; n++) {
            if (n < newLength - 1) {
                newFilers[n] = map(n, this.maxBufferSegmentSize);
            } else {
                newFilers[n] = map(n, filerSeek);
            }
        }
        bbs = newFilers;
    }

    public long length() {
        return length;
    }

    private ByteBuffer map(int index, long segmentLength) throws IOException {
        long segmentOffset = maxBufferSegmentSize * index;
        try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
            try (FileChannel channel = raf.getChannel()) {
                return channel.map(MapMode.READ_ONLY, segmentOffset, segmentLength);
            }
        }
    }

    private void checkBounds(long position, int length) throws EOFException {
        if (position < 0 || position + length > this.length) {
            throw new EOFException("Failed to read " + length + " bytes at " + position + " from " + file + " of length " + this.length);
        }
    }

    public int read(long position) throws IOException {
        checkBounds(position, 1);
        int bbIndex = (int) (position >> fShift);
        int bbSeek = (int) (position & fseekMask);
        return bbs[bbIndex].get(bbSeek) & 0xFF;
    }

    private boolean hasRemaining(int bbIndex, int bbSeek, int length) {
        return bbs[bbIndex].limit() - bbSeek >= length;
    }

    public int readInt(long position) throws IOException {
        checkBounds(position, 4);
        int bbIndex = (int) (position >> fShift);
        int bbSeek = (int) (position & fseekMask);

        if (hasRemaining(bbIndex, bbSeek, 4)) {
            return bbs[bbIndex].getInt(bbSeek);
        } else {
            int v = 0;
            for (int i = 0; i < 4; i++) {
                v <<= 8;
                v |= read(position + i);
            }
            return v;
        }
    }

    public long readLong(long position) throws IOException {
        checkBounds(position, 8);
        int bbIndex = (int) (position >> fShift);
        int bbSeek = (int) (position & fseekMask);

        if (hasRemaining(bbIndex, bbSeek, 8)) {
            return bbs[bbIndex].getLong(bbSeek);
        } else {
            long v = 0;
            for (int i = 0; i < 8; i++) {
                v <<= 8;
                v |= read(position + i);
            }
            return v;
        }
    }

    public void read(long position, byte[] b, int offset, int len) throws IOException {
        checkBounds(position, len);
        int copied = 0;
        while (copied < len) {
            long at = position + copied;
            int bbIndex = (int) (at >> fShift);
            int bbSeek = (int) (at & fseekMask);
            ByteBuffer bb = bbs[bbIndex];
            int count = Math.min(len - copied, bb.limit() - bbSeek);
            for (int i = 0; i < count; i++) {
                b[offset + copied + i] = bb.get(bbSeek + i);
            }
            copied += count;
        }
    }

    public BolBuffer sliceIntoBuffer(long offset, int length, BolBuffer entryBuffer) throws IOException {
        checkBounds(offset, length);
        int bbIndex = (int) (offset >> fShift);
        if (bbIndex == (int) ((offset + length) >> fShift) || length == 0) {
            int filerSeek = (int) (offset & fseekMask);
            entryBuffer.force(bbs[bbIndex], filerSeek, length);
        } else {
            byte[] rawEntry = new byte[length]; // only on segment boundaries
            read(offset, rawEntry, 0, length);
            entryBuffer.force(rawEntry, 0, length);
        }
        return entryBuffer;
    }

    public void close() {
        for (ByteBuffer bb : bbs) {
            if (bb != null) {
                DirectBufferCleaner.clean(bb);
            }
        }
    }

    @Override
    public String toString() {
        return "PointerReadableByteBufferFile{" + "file=" + file + ", length=" + length + ", segments=" + bbs.length + '}';
    }
}
