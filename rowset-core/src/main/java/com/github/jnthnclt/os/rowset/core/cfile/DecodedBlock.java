package com.github.jnthnclt.os.rowset.core.cfile;

/**
 * The values of one block, decoded into a typed array.
 */
class DecodedBlock {

    final int blockIndex;
    final long firstOrdinal;
    final int rowCount;
    final Object values;
    final long bytesOnDisk;

    DecodedBlock(int blockIndex, long firstOrdinal, int rowCount, Object values, long bytesOnDisk) {
        this.blockIndex = blockIndex;
        this.firstOrdinal = firstOrdinal;
        this.rowCount = rowCount;
        this.values = values;
        this.bytesOnDisk = bytesOnDisk;
    }

    @Override
    public String toString() {
        return "DecodedBlock{" + "blockIndex=" + blockIndex + ", firstOrdinal=" + firstOrdinal + ", rowCount=" + rowCount + '}';
    }
}
