package com.github.jnthnclt.os.rowset.core.api;

import com.github.jnthnclt.os.rowset.base.BolBuffer;
import com.github.jnthnclt.os.rowset.base.UIO;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The value types a column can hold.
 *
 * Every type knows how to order its values, how to encode a value as key bytes (membership filter, block index and
 * footer min/max) and how to lay values out inside a block payload. Decoded values live in primitive arrays
 * ({@code int[]}, {@code long[]}) or {@code String[]}, see {@link #newArray(int)}.
 *
 * @author jonathan.colt
 */
public enum ColumnType {

    INT32(4) {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Integer;
        }

        @Override
        public int compare(Object a, Object b) {
            return Integer.compare((Integer) a, (Integer) b);
        }

        @Override
        public int compareAt(Object values, int index, Object key) {
            return Integer.compare(((int[]) values)[index], (Integer) key);
        }

        @Override
        public byte[] encodeKey(Object value) {
            return UIO.intBytes((Integer) value);
        }

        @Override
        public Object decodeKey(byte[] bytes) throws RowsetCorruptedException {
            checkKeyLength(bytes, 4);
            return UIO.bytesInt(bytes);
        }

        @Override
        public int encodedLength(Object value) {
            return 4;
        }

        @Override
        public void write(IAppendOnly appendOnly, Object value) throws IOException {
            appendOnly.appendInt((Integer) value);
        }

        @Override
        public int read(BolBuffer payload, int offset, Object values, int index) throws RowsetCorruptedException {
            checkRemaining(payload, offset, 4);
            ((int[]) values)[index] = payload.getInt(offset);
            return 4;
        }

        @Override
        public Object newArray(int length) {
            return new int[length];
        }

        @Override
        public Object get(Object values, int index) {
            return ((int[]) values)[index];
        }

        @Override
        public void set(Object values, int index, Object value) {
            ((int[]) values)[index] = (Integer) value;
        }
    },
    INT64(8) {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Long;
        }

        @Override
        public int compare(Object a, Object b) {
            return Long.compare((Long) a, (Long) b);
        }

        @Override
        public int compareAt(Object values, int index, Object key) {
            return Long.compare(((long[]) values)[index], (Long) key);
        }

        @Override
        public byte[] encodeKey(Object value) {
            return UIO.longBytes((Long) value);
        }

        @Override
        public Object decodeKey(byte[] bytes) throws RowsetCorruptedException {
            checkKeyLength(bytes, 8);
            return UIO.bytesLong(bytes);
        }

        @Override
        public int encodedLength(Object value) {
            return 8;
        }

        @Override
        public void write(IAppendOnly appendOnly, Object value) throws IOException {
            appendOnly.appendLong((Long) value);
        }

        @Override
        public int read(BolBuffer payload, int offset, Object values, int index) throws RowsetCorruptedException {
            checkRemaining(payload, offset, 8);
            ((long[]) values)[index] = payload.getLong(offset);
            return 8;
        }

        @Override
        public Object newArray(int length) {
            return new long[length];
        }

        @Override
        public Object get(Object values, int index) {
            return ((long[]) values)[index];
        }

        @Override
        public void set(Object values, int index, Object value) {
            ((long[]) values)[index] = (Long) value;
        }
    },
    STRING(-1) {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }

        @Override
        public int compare(Object a, Object b) {
            return compareCodePoints((String) a, (String) b);
        }

        @Override
        public int compareAt(Object values, int index, Object key) {
            return compare(((String[]) values)[index], key);
        }

        @Override
        public byte[] encodeKey(Object value) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public Object decodeKey(byte[] bytes) throws RowsetCorruptedException {
            if (bytes == null) {
                throw new RowsetCorruptedException("Missing string key");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public int encodedLength(Object value) {
            return 4 + encodeKey(value).length;
        }

        @Override
        public void write(IAppendOnly appendOnly, Object value) throws IOException {
            byte[] bytes = encodeKey(value);
            appendOnly.appendInt(bytes.length);
            appendOnly.append(bytes, 0, bytes.length);
        }

        @Override
        public int read(BolBuffer payload, int offset, Object values, int index) throws RowsetCorruptedException {
            checkRemaining(payload, offset, 4);
            int length = payload.getInt(offset);
            if (length < 0) {
                throw new RowsetCorruptedException("Negative string length:" + length + " at payload offset:" + offset);
            }
            checkRemaining(payload, offset + 4, length);
            byte[] bytes = new byte[length];
            payload.get(offset + 4, bytes, 0, length);
            ((String[]) values)[index] = new String(bytes, StandardCharsets.UTF_8);
            return 4 + length;
        }

        @Override
        public Object newArray(int length) {
            return new String[length];
        }

        @Override
        public Object get(Object values, int index) {
            return ((String[]) values)[index];
        }

        @Override
        public void set(Object values, int index, Object value) {
            ((String[]) values)[index] = (String) value;
        }
    };

    /**
     * Bytes per value inside a block payload, or -1 when values are variable length.
     */
    public final int fixedWidth;

    ColumnType(int fixedWidth) {
        this.fixedWidth = fixedWidth;
    }

    public abstract boolean accepts(Object value);

    public abstract int compare(Object a, Object b);

    /**
     * Compares the decoded value at {@code index} of a typed values array against {@code key}.
     */
    public abstract int compareAt(Object values, int index, Object key);

    public abstract byte[] encodeKey(Object value);

    public abstract Object decodeKey(byte[] bytes) throws RowsetCorruptedException;

    public abstract int encodedLength(Object value);

    public abstract void write(IAppendOnly appendOnly, Object value) throws IOException;

    /**
     * Decodes one value from a block payload into {@code values[index]}.
     *
     * @return the number of payload bytes consumed
     */
    public abstract int read(BolBuffer payload, int offset, Object values, int index) throws RowsetCorruptedException;

    public abstract Object newArray(int length);

    public abstract Object get(Object values, int index);

    public abstract void set(Object values, int index, Object value);

    public void checkValue(Object value) {
        if (!accepts(value)) {
            throw new IllegalArgumentException("Value " + value + (value == null ? "" : " of " + value.getClass().getSimpleName())
                + " is not a valid " + this);
        }
    }

    public static ColumnType fromOrdinal(int ordinal) throws RowsetCorruptedException {
        ColumnType[] values = values();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new RowsetCorruptedException("Unknown column type:" + ordinal);
        }
        return values[ordinal];
    }

    private static void checkKeyLength(byte[] bytes, int expected) throws RowsetCorruptedException {
        if (bytes == null || bytes.length != expected) {
            throw new RowsetCorruptedException("Expected a " + expected + " byte key but found " + (bytes == null ? "null" : bytes.length));
        }
    }

    /**
     * Orders strings as their UTF-8 encodings order under unsigned byte comparison, without encoding them.
     */
    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Boolean.compare(i < a.length(), j < b.length());
    }

    private static void checkRemaining(BolBuffer payload, int offset, int length) throws RowsetCorruptedException {
        if (offset < 0 || length < 0 || length > payload.length - offset) {
            throw new RowsetCorruptedException("Payload overrun. offset:" + offset + " length:" + length + " payload:" + payload.length);
        }
    }
}
