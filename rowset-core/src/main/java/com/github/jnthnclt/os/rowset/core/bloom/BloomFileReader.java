package com.github.jnthnclt.os.rowset.core.bloom;

import com.github.jnthnclt.os.rowset.core.api.RowsetKeyProbe;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;

/**
 * A loaded membership filter. Answers "maybe present" or "definitely absent", never a definite yes.
 *
 * @author jonathan.colt
 */
public class BloomFileReader {

    private final File file;
    private final BloomFilter<byte[]> bloomFilter;

    private BloomFileReader(File file, BloomFilter<byte[]> bloomFilter) {
        this.file = file;
        this.bloomFilter = bloomFilter;
    }

    public static BloomFileReader open(File file) throws IOException, RowsetCorruptedException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(new FileInputStream(file)))) {
            int magic;
            int version;
            try {
                magic = in.readInt();
                version = in.readInt();
            } catch (EOFException x) {
                throw new RowsetCorruptedException("Bloom file is truncated. " + file, x);
            }
            if (magic != BloomFileWriter.MAGIC) {
                throw new RowsetCorruptedException("Bloom Corruption! Found magic " + Integer.toHexString(magic) + " expected "
                    + Integer.toHexString(BloomFileWriter.MAGIC) + " within file:" + file);
            }
            if (version != BloomFileWriter.VERSION) {
                throw new RowsetCorruptedException("Unsupported bloom file version " + version + " within file:" + file);
            }
            BloomFilter<byte[]> bloomFilter;
            try {
                bloomFilter = BloomFilter.readFrom(in, Funnels.byteArrayFunnel());
            } catch (IOException x) {
                throw new RowsetCorruptedException("Bloom Corruption! Unreadable filter within file:" + file, x);
            }
            return new BloomFileReader(file, bloomFilter);
        }
    }

    /**
     * @return false only when the key is definitely absent
     */
    public boolean checkKeyPresent(RowsetKeyProbe probe) {
        return bloomFilter.mightContain(probe.encodedKey());
    }

    public double expectedFpp() {
        return bloomFilter.expectedFpp();
    }

    public long approximateElementCount() {
        return bloomFilter.approximateElementCount();
    }

    @Override
    public String toString() {
        return "BloomFileReader{" + "file=" + file + '}';
    }
}
