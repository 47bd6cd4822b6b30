package com.github.jnthnclt.os.rowset.core.api;

/**
 * Blocks and bytes read by one column cursor.
 */
public class IOStatistics {

    public static final IOStatistics ZERO = new IOStatistics(0, 0);

    public final long blocksRead;
    public final long bytesRead;

    public IOStatistics(long blocksRead, long bytesRead) {
        this.blocksRead = blocksRead;
        this.bytesRead = bytesRead;
    }

    public IOStatistics plus(IOStatistics other) {
        return new IOStatistics(blocksRead + other.blocksRead, bytesRead + other.bytesRead);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IOStatistics that = (IOStatistics) o;
        return blocksRead == that.blocksRead && bytesRead == that.bytesRead;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(blocksRead) + Long.hashCode(bytesRead);
    }

    @Override
    public String toString() {
        return "IOStatistics{" + "blocksRead=" + blocksRead + ", bytesRead=" + bytesRead + '}';
    }
}
