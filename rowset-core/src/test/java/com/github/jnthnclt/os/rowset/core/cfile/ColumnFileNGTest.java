package com.github.jnthnclt.os.rowset.core.cfile;

import com.github.jnthnclt.os.rowset.core.RowsetStats;
import com.github.jnthnclt.os.rowset.core.RowsetTestUtils;
import com.github.jnthnclt.os.rowset.core.api.ColumnBlock;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.IOStatistics;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.io.AppendOnlyFile;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import java.io.File;
import java.io.RandomAccessFile;
import java.util.Arrays;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * @author jonathan.colt
 */
public class ColumnFileNGTest {

    private static final long SEGMENT = 1024 * 1024;

    private File writeLongs(int count, int step, int rowsPerBlock) throws Exception {
        List<Long> values = Lists.newArrayList();
        for (int i = 0; i < count; i++) {
            values.add((long) i * step);
        }
        File file = new File(Files.createTempDir(), "longs");
        RowsetTestUtils.writeColumn(file, ColumnType.INT64, rowsPerBlock, true, values);
        return file;
    }

    @Test
    public void testFooterAndIndex() throws Exception {
        File file = writeLongs(1000, 2, 100);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            Assert.assertEquals(reader.rowCount(), 1000);
            Assert.assertEquals(reader.type(), ColumnType.INT64);
            Assert.assertEquals(reader.sizeInBytes(), file.length());

            ColumnFileFooter footer = reader.footer();
            Assert.assertEquals(footer.blockCount(), 10);
            Assert.assertEquals(footer.valuesSizeInBytes(), 1000 * 8);
            Assert.assertEquals(ColumnType.INT64.decodeKey(footer.minValue()), 0L);
            Assert.assertEquals(ColumnType.INT64.decodeKey(footer.maxValue()), 1998L);

            BlockIndex index = reader.index();
            Assert.assertEquals(index.blockCount(), 10);
            Assert.assertEquals(index.blockForOrdinal(0), 0);
            Assert.assertEquals(index.blockForOrdinal(99), 0);
            Assert.assertEquals(index.blockForOrdinal(100), 1);
            Assert.assertEquals(index.blockForOrdinal(999), 9);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testOpenReadsNoBlocks() throws Exception {
        File file = writeLongs(1000, 1, 100);
        RowsetStats stats = new RowsetStats();
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, stats);
        try {
            Assert.assertEquals(stats.blocksRead.sum(), 0);
            ColumnFileIterator iterator = reader.newIterator();
            iterator.seekToOrdinal(500);
            Assert.assertEquals(iterator.ioStatistics(), IOStatistics.ZERO);

            iterator.prepareBatch(10);
            Assert.assertEquals(iterator.ioStatistics().blocksRead, 1);
            Assert.assertEquals(stats.blocksRead.sum(), 1);
            Assert.assertEquals(stats.bytesRead.sum(), iterator.ioStatistics().bytesRead);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testSeekAtOrAfter() throws Exception {
        File file = writeLongs(1000, 2, 64);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            for (int i = 0; i < 1000; i++) {
                Assert.assertTrue(iterator.seekAtOrAfter((long) i * 2));
                Assert.assertEquals(iterator.currentOrdinal(), i);

                Assert.assertFalse(iterator.seekAtOrAfter((long) i * 2 + 1));
                Assert.assertEquals(iterator.currentOrdinal(), i + 1);
            }
            Assert.assertFalse(iterator.seekAtOrAfter(-5L));
            Assert.assertEquals(iterator.currentOrdinal(), 0);
            Assert.assertFalse(iterator.seekAtOrAfter(5000L));
            Assert.assertEquals(iterator.currentOrdinal(), 1000);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testLowerBoundOrdinal() throws Exception {
        File file = writeLongs(300, 10, 32);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            Assert.assertEquals(iterator.lowerBoundOrdinal(50L, false), 5);
            Assert.assertEquals(iterator.lowerBoundOrdinal(50L, true), 6);
            Assert.assertEquals(iterator.lowerBoundOrdinal(55L, false), 6);
            Assert.assertEquals(iterator.lowerBoundOrdinal(55L, true), 6);
            Assert.assertEquals(iterator.lowerBoundOrdinal(-1L, false), 0);
            Assert.assertEquals(iterator.lowerBoundOrdinal(2990L, false), 299);
            Assert.assertEquals(iterator.lowerBoundOrdinal(2990L, true), 300);
            // block boundaries
            Assert.assertEquals(iterator.lowerBoundOrdinal(310L, false), 31);
            Assert.assertEquals(iterator.lowerBoundOrdinal(310L, true), 32);
            Assert.assertEquals(iterator.lowerBoundOrdinal(320L, false), 32);
        } finally {
            reader.close();
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testKeyOfWrongType() throws Exception {
        File file = writeLongs(10, 1, 4);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            reader.newIterator().lowerBoundOrdinal(5, false);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testBatchesAcrossBlocks() throws Exception {
        File file = writeLongs(1000, 1, 64);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            ColumnBlock block = new ColumnBlock(ColumnType.INT64, 150);
            iterator.seekToOrdinal(10);
            long expected = 10;
            while (iterator.currentOrdinal() < 1000) {
                int prepared = iterator.prepareBatch(150);
                Assert.assertEquals(prepared, Math.min(150, 1000 - expected));
                iterator.scan(block, prepared);
                Assert.assertEquals(block.size(), prepared);
                for (int i = 0; i < prepared; i++) {
                    Assert.assertEquals(block.getLong(i), expected);
                    expected++;
                }
                iterator.finishBatch();
            }
            Assert.assertEquals(expected, 1000);
            // 16 blocks, each read exactly once even though batches straddle them
            Assert.assertEquals(iterator.ioStatistics().blocksRead, 16);
            Assert.assertEquals(iterator.prepareBatch(10), 0);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testStrings() throws Exception {
        List<String> names = Arrays.asList("apple", "banana", "cherry", "date", "elderberry", "fig", "grape", "éclair");
        File file = new File(Files.createTempDir(), "strings");
        RowsetTestUtils.writeColumn(file, ColumnType.STRING, 3, true, names);

        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            Assert.assertEquals(reader.rowCount(), names.size());
            Assert.assertEquals(reader.index().blockCount(), 3);
            ColumnFileIterator iterator = reader.newIterator();
            Assert.assertTrue(iterator.seekAtOrAfter("date"));
            Assert.assertEquals(iterator.currentOrdinal(), 3);
            Assert.assertFalse(iterator.seekAtOrAfter("d"));
            Assert.assertEquals(iterator.currentOrdinal(), 3);
            Assert.assertTrue(iterator.seekAtOrAfter("éclair"));
            Assert.assertEquals(iterator.currentOrdinal(), 7);

            iterator.seekToOrdinal(0);
            ColumnBlock block = new ColumnBlock(ColumnType.STRING, names.size());
            iterator.scan(block, iterator.prepareBatch(names.size()));
            for (int i = 0; i < names.size(); i++) {
                Assert.assertEquals(block.getString(i), names.get(i));
            }
        } finally {
            reader.close();
        }
    }

    @Test
    public void testEmptyColumn() throws Exception {
        File file = writeLongs(0, 1, 10);
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            Assert.assertEquals(reader.rowCount(), 0);
            Assert.assertNull(reader.footer().minValue());
            ColumnFileIterator iterator = reader.newIterator();
            Assert.assertFalse(iterator.seekAtOrAfter(1L));
            Assert.assertEquals(iterator.prepareBatch(10), 0);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testSmallBufferSegments() throws Exception {
        File file = writeLongs(500, 3, 7);
        ColumnFileReader reader = ColumnFileReader.open(file, 64, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            ColumnBlock block = new ColumnBlock(ColumnType.INT64, 500);
            iterator.scan(block, iterator.prepareBatch(500));
            for (int i = 0; i < 500; i++) {
                Assert.assertEquals(block.getLong(i), i * 3L);
            }
        } finally {
            reader.close();
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAscendingEnforced() throws Exception {
        ColumnFileWriter writer = new ColumnFileWriter(new AppendOnlyFile(new File(Files.createTempDir(), "keys")), ColumnType.INT64, 10, true);
        writer.append(1L);
        writer.append(2L);
        writer.append(2L);
    }

    @Test
    public void testUnorderedValuesAllowed() throws Exception {
        File file = new File(Files.createTempDir(), "values");
        RowsetTestUtils.writeColumn(file, ColumnType.INT32, 2, false, Arrays.asList(5, 1, 4, 1));
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            Assert.assertEquals(ColumnType.INT32.decodeKey(reader.footer().minValue()), 1);
            Assert.assertEquals(ColumnType.INT32.decodeKey(reader.footer().maxValue()), 5);
        } finally {
            reader.close();
        }
    }

    @Test(expectedExceptions = RowsetCorruptedException.class)
    public void testEmptyFile() throws Exception {
        File file = new File(Files.createTempDir(), "empty");
        Assert.assertTrue(file.createNewFile());
        ColumnFileReader.open(file, SEGMENT, new RowsetStats());
    }

    @Test(expectedExceptions = RowsetCorruptedException.class)
    public void testFooterLengthCorruption() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(raf.length() - 4);
            raf.writeInt(Integer.MAX_VALUE);
        }
        ColumnFileReader.open(file, SEGMENT, new RowsetStats());
    }

    @Test(expectedExceptions = RowsetCorruptedException.class)
    public void testFooterMarkerCorruption() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(raf.length() - 4);
            int footerLength = raf.readInt();
            raf.seek(raf.length() - (1 + footerLength));
            raf.writeByte(9);
        }
        ColumnFileReader.open(file, SEGMENT, new RowsetStats());
    }

    @Test(expectedExceptions = RowsetCorruptedException.class)
    public void testTruncatedFile() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(raf.length() - 4);
            int footerLength = raf.readInt();
            long footerFp = raf.length() - (1 + footerLength);
            // cut the file inside the index, then restore a trailing footer length that points before the start
            raf.setLength(footerFp - 5);
            raf.seek(raf.length() - 4);
            raf.writeInt(footerLength);
        }
        ColumnFileReader.open(file, SEGMENT, new RowsetStats());
    }

    @Test
    public void testBlockMarkerCorruption() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(0);
            raf.writeByte(7);
        }
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            iterator.seekToOrdinal(50);
            Assert.assertEquals(iterator.prepareBatch(10), 10);
            iterator.seekToOrdinal(0);
            iterator.prepareBatch(10);
            Assert.fail("Expected a corrupted block");
        } catch (RowsetCorruptedException x) {
            Assert.assertTrue(x.getMessage().contains("Block Corruption"), x.getMessage());
        } finally {
            reader.close();
        }
    }

    @Test
    public void testBlockRowCountCorruption() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(1 + 4);
            raf.writeInt(11);
        }
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            reader.newIterator().seekAtOrAfter(3L);
            Assert.fail("Expected a corrupted block");
        } catch (RowsetCorruptedException x) {
            Assert.assertTrue(x.getMessage().contains("holds 11 rows"), x.getMessage());
        } finally {
            reader.close();
        }
    }

    @Test
    public void testBlockPayloadLengthCorruption() throws Exception {
        File file = writeLongs(100, 1, 10);
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek(1);
            raf.writeInt(79);
        }
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            ColumnFileIterator iterator = reader.newIterator();
            iterator.prepareBatch(1);
            Assert.fail("Expected a corrupted block");
        } catch (RowsetCorruptedException x) {
            Assert.assertTrue(x.getMessage().contains("payload"), x.getMessage());
        } finally {
            reader.close();
        }
    }

    @Test
    public void testStringLengthCorruption() throws Exception {
        File file = new File(Files.createTempDir(), "strings");
        RowsetTestUtils.writeColumn(file, ColumnType.STRING, 10, true, Arrays.asList("a", "b", "c"));
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            // marker, payload length and row count precede the first value's length
            raf.seek(1 + 4 + 4);
            raf.writeInt(Integer.MAX_VALUE - 2);
        }
        ColumnFileReader reader = ColumnFileReader.open(file, SEGMENT, new RowsetStats());
        try {
            reader.newIterator().prepareBatch(1);
            Assert.fail("Expected a corrupted string length");
        } catch (RowsetCorruptedException x) {
            Assert.assertTrue(x.getMessage().contains("Payload overrun"), x.getMessage());
        } finally {
            reader.close();
        }
    }
}
