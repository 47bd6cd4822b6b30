package com.github.jnthnclt.os.rowset.core.api;

/**
 * The immutable base data of one rowset.
 *
 * @author jonathan.colt
 */
public interface RowsetBaseData {

    Schema schema();

    long countRows() throws Exception;

    long estimateOnDiskSize() throws Exception;

    /**
     * @return the ordinal of the row with this key or -1
     */
    long findRow(RowsetKeyProbe probe) throws Exception;

    boolean checkRowPresent(RowsetKeyProbe probe) throws Exception;

    ColumnwiseIterator newIterator(Schema projection) throws Exception;

}
