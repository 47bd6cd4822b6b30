package com.github.jnthnclt.os.rowset.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @author jonathan.colt
 */
public class RowsetConfig {

    public static final long DEFAULT_BUFFER_SEGMENT_SIZE = 1024L * 1024 * 1024;
    public static final String DEFAULT_COLUMN_FILE_PREFIX = "col_";
    public static final String DEFAULT_BLOOM_FILE_NAME = "bloom";

    public static final RowsetConfig DEFAULT = new RowsetConfig(DEFAULT_BUFFER_SEGMENT_SIZE, DEFAULT_COLUMN_FILE_PREFIX, DEFAULT_BLOOM_FILE_NAME, true);

    public final long bufferSegmentSize;
    public final String columnFilePrefix;
    public final String bloomFileName;
    public final boolean openBloomFilter;

    @JsonCreator
    public RowsetConfig(@JsonProperty("bufferSegmentSize") long bufferSegmentSize,
        @JsonProperty("columnFilePrefix") String columnFilePrefix,
        @JsonProperty("bloomFileName") String bloomFileName,
        @JsonProperty("openBloomFilter") Boolean openBloomFilter) {

        this.bufferSegmentSize = bufferSegmentSize > 0 ? bufferSegmentSize : DEFAULT_BUFFER_SEGMENT_SIZE;
        this.columnFilePrefix = columnFilePrefix != null ? columnFilePrefix : DEFAULT_COLUMN_FILE_PREFIX;
        this.bloomFileName = bloomFileName != null ? bloomFileName : DEFAULT_BLOOM_FILE_NAME;
        this.openBloomFilter = openBloomFilter == null || openBloomFilter;
    }

    @Override
    public String toString() {
        return "RowsetConfig{"
            + "bufferSegmentSize=" + bufferSegmentSize
            + ", columnFilePrefix=" + columnFilePrefix
            + ", bloomFileName=" + bloomFileName
            + ", openBloomFilter=" + openBloomFilter
            + '}';
    }
}
