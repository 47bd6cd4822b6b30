package com.github.jnthnclt.os.rowset.core.api;

import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The predicates of one scan. Iterators that can satisfy a predicate themselves remove it, whatever remains must be
 * evaluated by the caller.
 *
 * @author jonathan.colt
 */
public class ScanSpec {

    private final List<ColumnRangePredicate> predicates = Lists.newArrayList();

    public ScanSpec addPredicate(ColumnRangePredicate predicate) {
        predicates.add(predicate);
        return this;
    }

    public List<ColumnRangePredicate> predicates() {
        return Collections.unmodifiableList(predicates);
    }

    /**
     * Removes and returns every predicate on the named column, in the order they were added.
     */
    public List<ColumnRangePredicate> removePredicatesOn(String column) {
        List<ColumnRangePredicate> removed = Lists.newArrayList();
        for (Iterator<ColumnRangePredicate> iterator = predicates.iterator(); iterator.hasNext(); ) {
            ColumnRangePredicate predicate = iterator.next();
            if (predicate.column.equals(column)) {
                removed.add(predicate);
                iterator.remove();
            }
        }
        return removed;
    }

    @Override
    public String toString() {
        return "ScanSpec{" + "predicates=" + predicates + '}';
    }
}
