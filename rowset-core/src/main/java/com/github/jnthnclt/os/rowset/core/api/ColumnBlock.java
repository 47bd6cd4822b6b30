package com.github.jnthnclt.os.rowset.core.api;

import com.google.common.base.Preconditions;

/**
 * Caller owned destination for one column of one batch.
 *
 * @author jonathan.colt
 */
public class ColumnBlock {

    private final ColumnType type;
    private final Object values;
    private final int capacity;
    private int size;

    public ColumnBlock(ColumnType type, int capacity) {
        Preconditions.checkArgument(capacity >= 0, "Negative capacity:%s", capacity);
        this.type = type;
        this.capacity = capacity;
        this.values = type.newArray(capacity);
    }

    public ColumnType type() {
        return type;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return size;
    }

    /**
     * Copies {@code count} decoded values of this block's type into {@code [dstOffset, dstOffset + count)}.
     */
    public void copyFrom(Object src, int srcOffset, int dstOffset, int count) {
        Preconditions.checkPositionIndexes(dstOffset, dstOffset + count, capacity);
        System.arraycopy(src, srcOffset, values, dstOffset, count);
        size = Math.max(size, dstOffset + count);
    }

    public void reset() {
        size = 0;
    }

    public Object get(int index) {
        Preconditions.checkElementIndex(index, size);
        return type.get(values, index);
    }

    public int getInt(int index) {
        Preconditions.checkElementIndex(index, size);
        return ((int[]) values)[index];
    }

    public long getLong(int index) {
        Preconditions.checkElementIndex(index, size);
        return ((long[]) values)[index];
    }

    public String getString(int index) {
        Preconditions.checkElementIndex(index, size);
        return ((String[]) values)[index];
    }

    @Override
    public String toString() {
        return "ColumnBlock{" + "type=" + type + ", capacity=" + capacity + ", size=" + size + '}';
    }
}
