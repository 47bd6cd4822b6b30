package com.github.jnthnclt.os.rowset.base;

import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import java.nio.ByteBuffer;

/**
 * A window onto either a heap byte array or a (usually memory mapped) byte buffer.
 *
 * @author jonathan.colt
 */
public class BolBuffer {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    public volatile ByteBuffer bb;
    public volatile byte[] bytes;
    public volatile int offset;
    public volatile int length = -1;

    public BolBuffer() {
    }

    public BolBuffer(byte[] bytes) {
        this(bytes, 0, bytes == null ? -1 : bytes.length);
    }

    public BolBuffer(byte[] bytes, int offset, int length) {
        this.bytes = bytes;
        this.offset = offset;
        this.length = length;
    }

    public void force(ByteBuffer bb, int offset, int length) {
        this.bytes = null;
        this.bb = bb;
        this.offset = offset;
        this.length = length;
        if (offset + length > bb.limit()) {
            throw new IllegalArgumentException(bb + " cannot support offset=" + offset + " length=" + length);
        }
    }

    public void force(byte[] bytes, int offset, int length) {
        this.bb = null;
        this.bytes = bytes;
        this.offset = offset;
        this.length = length;
        if (offset + length > bytes.length) {
            throw new IllegalArgumentException(bytes.length + " cannot support offset=" + offset + " length=" + length);
        }
    }

    public byte get(int offset) {
        try {
            if (bb != null) {
                return bb.get(this.offset + offset);
            }
            return bytes[this.offset + offset];
        } catch (RuntimeException x) {
            LOG.error("get({}) failed against {}", offset, this);
            throw x;
        }
    }

    public int getInt(int offset) {
        try {
            if (bb != null) {
                return bb.getInt(this.offset + offset);
            }
            return UIO.bytesInt(bytes, this.offset + offset);
        } catch (RuntimeException x) {
            LOG.error("getInt({}) failed against {}", offset, this);
            throw x;
        }
    }

    public long getLong(int offset) {
        try {
            if (bb != null) {
                return bb.getLong(this.offset + offset);
            }
            return UIO.bytesLong(bytes, this.offset + offset);
        } catch (RuntimeException x) {
            LOG.error("getLong({}) failed against {}", offset, this);
            throw x;
        }
    }

    /**
     * Copies {@code length} bytes starting at {@code offset} (relative to this window) into {@code copyInto}.
     */
    public void get(int offset, byte[] copyInto, int copyIntoOffset, int length) {
        if (offset < 0 || length < 0 || length > this.length - offset) {
            throw new IndexOutOfBoundsException("offset=" + offset + " length=" + length + " exceeds " + this);
        }
        if (bb != null) {
            for (int i = 0; i < length; i++) {
                copyInto[copyIntoOffset + i] = bb.get(this.offset + offset + i);
            }
        } else {
            System.arraycopy(bytes, this.offset + offset, copyInto, copyIntoOffset, length);
        }
    }

    public byte[] copy() {
        if (length == -1) {
            return null;
        }
        byte[] copy = new byte[length];
        if (bb != null) {
            for (int i = 0; i < length; i++) {
                copy[i] = bb.get(offset + i);
            }
        } else {
            System.arraycopy(bytes, offset, copy, 0, length);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "BolBuffer{" + "bb=" + bb + ", bytes=" + ((bytes == null) ? null : bytes.length) + ", offset=" + offset + ", length=" + length + '}';
    }

}
