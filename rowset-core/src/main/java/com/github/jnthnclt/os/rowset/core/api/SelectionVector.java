package com.github.jnthnclt.os.rowset.core.api;

import com.google.common.base.Preconditions;
import org.roaringbitmap.RoaringBitmap;

/**
 * Which rows of the current batch are still selected.
 *
 * @author jonathan.colt
 */
public class SelectionVector {

    private final RoaringBitmap selected = new RoaringBitmap();
    private int numRows;

    public SelectionVector(int numRows) {
        resize(numRows);
    }

    public int numRows() {
        return numRows;
    }

    /**
     * Changes the number of rows covered. Rows past the new size are deselected.
     */
    public void resize(int numRows) {
        Preconditions.checkArgument(numRows >= 0, "Negative row count:%s", numRows);
        if (numRows < this.numRows) {
            selected.remove(numRows, (long) this.numRows);
        }
        this.numRows = numRows;
    }

    public void setAllTrue() {
        selected.clear();
        selected.add(0L, (long) numRows);
    }

    public void setAllFalse() {
        selected.clear();
    }

    public void setRowSelected(int row, boolean isSelected) {
        Preconditions.checkElementIndex(row, numRows);
        if (isSelected) {
            selected.add(row);
        } else {
            selected.remove(row);
        }
    }

    public boolean isRowSelected(int row) {
        Preconditions.checkElementIndex(row, numRows);
        return selected.contains(row);
    }

    public int countSelected() {
        return selected.getCardinality();
    }

    public boolean anySelected() {
        return !selected.isEmpty();
    }

    @Override
    public String toString() {
        return "SelectionVector{" + "numRows=" + numRows + ", selected=" + selected.getCardinality() + '}';
    }
}
