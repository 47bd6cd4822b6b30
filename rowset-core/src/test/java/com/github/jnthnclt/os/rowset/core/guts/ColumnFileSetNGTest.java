package com.github.jnthnclt.os.rowset.core.guts;

import com.github.jnthnclt.os.rowset.core.RowsetConfig;
import com.github.jnthnclt.os.rowset.core.RowsetEnvironment;
import com.github.jnthnclt.os.rowset.core.RowsetEnvironmentBuilder;
import com.github.jnthnclt.os.rowset.core.RowsetStats;
import com.github.jnthnclt.os.rowset.core.RowsetTestUtils;
import com.github.jnthnclt.os.rowset.core.api.ColumnSchema;
import com.github.jnthnclt.os.rowset.core.api.ColumnType;
import com.github.jnthnclt.os.rowset.core.api.RowsetKeyProbe;
import com.github.jnthnclt.os.rowset.core.api.Schema;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetClosedException;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.google.common.io.Files;
import java.io.File;
import java.io.FileNotFoundException;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * @author jonathan.colt
 */
public class ColumnFileSetNGTest {

    private RowsetStats stats;
    private RowsetEnvironment env;

    @BeforeMethod
    public void setUp() {
        stats = new RowsetStats();
        env = new RowsetEnvironmentBuilder().setStats(stats).build();
    }

    @AfterMethod
    public void tearDown() {
        env.shutdown();
    }

    private RowsetKeyProbe probe(long key) {
        return new RowsetKeyProbe(ColumnType.INT64, key);
    }

    @Test
    public void testOpenAllColumns() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 1000, 1, 100, true);

        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            Assert.assertEquals(set.countRows(), 1000);
            Assert.assertEquals(set.schema(), RowsetTestUtils.SCHEMA);
            Assert.assertTrue(set.hasBloomFilter());
            Assert.assertEquals(set.toString(), "column file base data in " + dir);
            Assert.assertEquals(stats.columnsOpened.sum(), 3);
            Assert.assertEquals(stats.bloomFiltersOpened.sum(), 1);
            Assert.assertEquals(stats.open.sum(), 1);
            Assert.assertEquals(stats.blocksRead.sum(), 0);

            long expectedSize = env.columnFile(dir, 0).length() + env.columnFile(dir, 1).length() + env.columnFile(dir, 2).length();
            Assert.assertEquals(set.estimateOnDiskSize(), expectedSize);
        } finally {
            set.close();
        }
        Assert.assertTrue(set.isClosed());
        Assert.assertEquals(stats.closed.sum(), 1);
    }

    @Test
    public void testOpenKeyColumns() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 500, 2, 64, false);

        ColumnFileSet set = env.openKeys(dir, RowsetTestUtils.SCHEMA);
        try {
            Assert.assertEquals(set.countRows(), 500);
            Assert.assertFalse(set.hasBloomFilter());
            Assert.assertEquals(set.estimateOnDiskSize(), env.columnFile(dir, 0).length());
            Assert.assertEquals(set.findRow(probe(20)), 10);
            Assert.assertTrue(set.checkRowPresent(probe(998)));
            Assert.assertFalse(set.checkRowPresent(probe(999)));
        } finally {
            set.close();
        }
    }

    @Test
    public void testFindRow() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 1000, 2, 37, false);

        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            for (int i = 0; i < 1000; i++) {
                Assert.assertEquals(set.findRow(probe(i * 2L)), i);
                Assert.assertEquals(set.findRow(probe(i * 2L + 1)), -1);
            }
            Assert.assertEquals(set.findRow(probe(-1)), -1);
            Assert.assertEquals(set.findRow(probe(Long.MAX_VALUE)), -1);
            Assert.assertEquals(stats.findRow.sum(), 2002);
        } finally {
            set.close();
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFindRowWrongKeyType() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 10, 1, 4, false);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            set.findRow(new RowsetKeyProbe(ColumnType.INT32, 3));
        } finally {
            set.close();
        }
    }

    @Test
    public void testCheckRowPresentWithBloom() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 1000, 2, 100, true);

        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            for (int i = 0; i < 1000; i++) {
                Assert.assertTrue(set.checkRowPresent(probe(i * 2L)), "key:" + (i * 2));
                Assert.assertFalse(set.checkRowPresent(probe(i * 2L + 1)), "key:" + (i * 2 + 1));
            }
            Assert.assertEquals(stats.bloomProbes.sum(), 2000);
            // most absent keys never reach the key column
            Assert.assertTrue(stats.bloomAbsent.sum() > 900, "bloomAbsent:" + stats.bloomAbsent.sum());
        } finally {
            set.close();
        }
    }

    @Test
    public void testBloomDisabledByConfig() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, true);

        RowsetEnvironment noBloom = new RowsetEnvironmentBuilder()
            .setConfig(new RowsetConfig(0, null, null, false))
            .build();
        ColumnFileSet set = noBloom.open(dir, RowsetTestUtils.SCHEMA);
        try {
            Assert.assertFalse(set.hasBloomFilter());
            Assert.assertTrue(set.checkRowPresent(probe(50)));
            Assert.assertFalse(set.checkRowPresent(probe(500)));
        } finally {
            set.close();
            noBloom.shutdown();
        }
    }

    @Test
    public void testRowCountMismatch() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, false);
        File values = env.columnFile(dir, 1);
        Assert.assertTrue(values.delete());
        RowsetTestUtils.writeColumn(values, ColumnType.INT32, 10, false, Arrays.asList(1, 2, 3));

        ColumnFileSet set = new ColumnFileSet(env, dir, RowsetTestUtils.SCHEMA);
        try {
            set.openAllColumns();
            Assert.fail("Expected a row count mismatch");
        } catch (RowsetCorruptedException x) {
            Assert.assertTrue(x.getMessage().contains("has 3 rows"), x.getMessage());
        }
        Assert.assertEquals(stats.open.sum(), 0);
        try {
            set.countRows();
            Assert.fail("A failed open leaves the set unusable");
        } catch (IllegalStateException x) {
            Assert.assertTrue(x.getMessage().contains("failed to open"), x.getMessage());
        }
    }

    @Test
    public void testMissingColumnFile() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, false);
        Assert.assertTrue(env.columnFile(dir, 2).delete());

        ColumnFileSet set = new ColumnFileSet(env, dir, RowsetTestUtils.SCHEMA);
        try {
            set.openAllColumns();
            Assert.fail("Expected a missing file");
        } catch (FileNotFoundException x) {
            // expected
        }
        try {
            set.openAllColumns();
            Assert.fail("A failed set cannot be reopened");
        } catch (IllegalStateException x) {
            Assert.assertTrue(x.getMessage().contains("failed to open"), x.getMessage());
        }
    }

    @Test(expectedExceptions = RowsetCorruptedException.class)
    public void testColumnTypeMismatch() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, false);
        Schema wrong = Schema.of(new ColumnSchema("id", ColumnType.INT64),
            new ColumnSchema("value", ColumnType.INT64),
            new ColumnSchema("name", ColumnType.STRING));
        env.open(dir, wrong);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testOpenTwice() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 10, 1, 10, false);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            set.openKeyColumns();
        } finally {
            set.close();
        }
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testUnopened() throws Exception {
        new ColumnFileSet(env, Files.createTempDir(), RowsetTestUtils.SCHEMA).findRow(probe(1));
    }

    @Test
    public void testEmptyRowset() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 0, 1, 10, true);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);
        try {
            Assert.assertEquals(set.countRows(), 0);
            Assert.assertEquals(set.findRow(probe(0)), -1);
            Assert.assertFalse(set.checkRowPresent(probe(0)));
            try (ColumnFileSetIterator iterator = set.newIterator(RowsetTestUtils.SCHEMA)) {
                iterator.init(null);
                Assert.assertFalse(iterator.hasNext());
            }
        } finally {
            set.close();
        }
    }

    @Test
    public void testRetireWaitsForIterators() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, false);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);

        ColumnFileSetIterator first = set.newIterator(RowsetTestUtils.SCHEMA);
        ColumnFileSetIterator second = set.newIterator(RowsetTestUtils.SCHEMA);
        Future<Void> retired = set.retire();
        try {
            retired.get(100, TimeUnit.MILLISECONDS);
            Assert.fail("Retire must wait for open iterators");
        } catch (TimeoutException x) {
            // expected
        }
        Assert.assertFalse(set.isClosed());

        first.init(null);
        Assert.assertTrue(first.hasNext());
        first.close();
        first.close();
        Assert.assertFalse(set.isClosed());

        second.close();
        retired.get(10, TimeUnit.SECONDS);
        Assert.assertTrue(set.isClosed());

        try {
            set.newIterator(RowsetTestUtils.SCHEMA);
            Assert.fail("A retired set hands out no iterators");
        } catch (RowsetClosedException x) {
            // expected
        }
        try {
            set.findRow(probe(1));
            Assert.fail("A retired set answers no lookups");
        } catch (RowsetClosedException x) {
            // expected
        }
    }

    @Test(timeOut = 30_000)
    public void testLookupWhileScanningDuringRetire() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, true);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);

        ColumnFileSetIterator iterator = set.newIterator(RowsetTestUtils.SCHEMA);
        iterator.init(null);
        Future<Void> retired = set.retire();
        while (!set.isClosePending()) {
            Thread.sleep(1);
        }

        // the scan's own lookups are still served while the retire waits on its share
        Assert.assertTrue(set.checkRowPresent(probe(5)));
        Assert.assertEquals(set.findRow(probe(42)), 42);
        Assert.assertFalse(retired.isDone());
        try {
            set.newIterator(RowsetTestUtils.SCHEMA);
            Assert.fail("A retiring set hands out no iterators");
        } catch (RowsetClosedException x) {
            Assert.assertTrue(x.getMessage().contains("retired"), x.getMessage());
        }

        Assert.assertEquals(iterator.prepareBatch(10), 10);
        iterator.finishBatch();
        iterator.close();
        retired.get(10, TimeUnit.SECONDS);
        Assert.assertTrue(set.isClosed());
    }

    @Test(timeOut = 30_000)
    public void testLookupFromAnotherThreadDuringRetire() throws Exception {
        File dir = Files.createTempDir();
        RowsetTestUtils.writeRowset(env, dir, 100, 1, 10, false);
        ColumnFileSet set = env.open(dir, RowsetTestUtils.SCHEMA);

        ExecutorService scanner = Executors.newSingleThreadExecutor();
        try {
            ColumnFileSetIterator iterator = scanner.submit(() -> {
                ColumnFileSetIterator opened = set.newIterator(RowsetTestUtils.SCHEMA);
                opened.init(null);
                return opened;
            }).get();
            Future<Void> retired = set.retire();
            while (!set.isClosePending()) {
                Thread.sleep(1);
            }

            Future<Boolean> present = scanner.submit(() -> {
                boolean found = set.checkRowPresent(probe(5));
                iterator.close();
                return found;
            });
            Assert.assertTrue(present.get(10, TimeUnit.SECONDS));
            retired.get(10, TimeUnit.SECONDS);
            Assert.assertTrue(set.isClosed());
        } finally {
            scanner.shutdownNow();
        }
    }
}
