package com.github.jnthnclt.os.rowset.core.api;

import java.util.List;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * @author jonathan.colt
 */
public class ColumnRangePredicateNGTest {

    @Test
    public void testMatches() {
        ColumnRangePredicate closed = ColumnRangePredicate.range("a", 10L, 20L);
        Assert.assertFalse(closed.matches(ColumnType.INT64, 9L));
        Assert.assertTrue(closed.matches(ColumnType.INT64, 10L));
        Assert.assertTrue(closed.matches(ColumnType.INT64, 20L));
        Assert.assertFalse(closed.matches(ColumnType.INT64, 21L));

        ColumnRangePredicate open = ColumnRangePredicate.range("a", 10L, false, 20L, false);
        Assert.assertFalse(open.matches(ColumnType.INT64, 10L));
        Assert.assertTrue(open.matches(ColumnType.INT64, 11L));
        Assert.assertFalse(open.matches(ColumnType.INT64, 20L));

        Assert.assertTrue(ColumnRangePredicate.atMost("a", "m").matches(ColumnType.STRING, "apple"));
        Assert.assertFalse(ColumnRangePredicate.lessThan("a", "m").matches(ColumnType.STRING, "m"));
        Assert.assertTrue(ColumnRangePredicate.greaterThan("a", 5).matches(ColumnType.INT32, 6));
    }

    @Test
    public void testEquality() {
        Assert.assertTrue(ColumnRangePredicate.equality("a", 7L).isEquality());
        Assert.assertFalse(ColumnRangePredicate.range("a", 7L, false, 7L, true).isEquality());
        Assert.assertFalse(ColumnRangePredicate.atLeast("a", 7L).isEquality());
        Assert.assertEquals(ColumnRangePredicate.equality("a", 7L).toString(), "a in [7, 7]");
        Assert.assertEquals(ColumnRangePredicate.greaterThan("a", 7L).toString(), "a in (7, +inf)");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnbounded() {
        ColumnRangePredicate.range("a", null, null);
    }

    @Test
    public void testScanSpec() {
        ColumnRangePredicate a1 = ColumnRangePredicate.atLeast("a", 1L);
        ColumnRangePredicate b = ColumnRangePredicate.atLeast("b", 1L);
        ColumnRangePredicate a2 = ColumnRangePredicate.atMost("a", 9L);
        ScanSpec spec = new ScanSpec().addPredicate(a1).addPredicate(b).addPredicate(a2);

        List<ColumnRangePredicate> removed = spec.removePredicatesOn("a");
        Assert.assertEquals(removed.size(), 2);
        Assert.assertSame(removed.get(0), a1);
        Assert.assertSame(removed.get(1), a2);
        Assert.assertEquals(spec.predicates().size(), 1);
        Assert.assertSame(spec.predicates().get(0), b);
        Assert.assertTrue(spec.removePredicatesOn("c").isEmpty());
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testPredicatesView() {
        new ScanSpec().predicates().add(ColumnRangePredicate.atLeast("a", 1L));
    }
}
