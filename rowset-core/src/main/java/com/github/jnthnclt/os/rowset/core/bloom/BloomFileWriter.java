package com.github.jnthnclt.os.rowset.core.bloom;

import com.github.jnthnclt.os.rowset.core.api.RowsetKeyProbe;
import com.google.common.base.Preconditions;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;

/**
 * Builds the membership filter over a rowset's encoded keys.
 *
 * @author jonathan.colt
 */
public class BloomFileWriter {

    public static final int MAGIC = 0x524f5742; // "ROWB"
    public static final int VERSION = 1;

    private final File file;
    private final BloomFilter<byte[]> bloomFilter;
    private long count;

    public BloomFileWriter(File file, long expectedInsertions, double falsePositiveProbability) {
        Preconditions.checkArgument(falsePositiveProbability > 0.0 && falsePositiveProbability < 1.0,
            "False positive probability must be in (0, 1) but was %s", falsePositiveProbability);
        this.file = file;
        this.bloomFilter = BloomFilter.create(Funnels.byteArrayFunnel(), Math.max(1, expectedInsertions), falsePositiveProbability);
    }

    public void add(RowsetKeyProbe probe) {
        add(probe.encodedKey());
    }

    public void add(byte[] encodedKey) {
        bloomFilter.put(encodedKey);
        count++;
    }

    public long count() {
        return count;
    }

    public void close(boolean fsync) throws IOException {
        try (FileOutputStream fos = new FileOutputStream(file);
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(fos))) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            bloomFilter.writeTo(out);
            out.flush();
            if (fsync) {
                fos.getFD().sync();
            }
        }
    }

    @Override
    public String toString() {
        return "BloomFileWriter{" + "file=" + file + ", count=" + count + '}';
    }
}
