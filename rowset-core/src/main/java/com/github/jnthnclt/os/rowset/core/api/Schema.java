package com.github.jnthnclt.os.rowset.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of columns. Column 0 is the key column and rows are stored in strictly ascending key order.
 *
 * @author jonathan.colt
 */
public class Schema {

    private final List<ColumnSchema> columns;
    private final Map<String, Integer> positions;

    @JsonCreator
    public Schema(@JsonProperty("columns") List<ColumnSchema> columns) {
        Preconditions.checkArgument(columns != null && !columns.isEmpty(), "A schema requires at least one column");
        this.columns = ImmutableList.copyOf(columns);
        this.positions = Maps.newHashMapWithExpectedSize(columns.size());
        for (int i = 0; i < this.columns.size(); i++) {
            Integer had = positions.put(this.columns.get(i).name, i);
            Preconditions.checkArgument(had == null, "Duplicate column name:%s", this.columns.get(i).name);
        }
    }

    public static Schema of(ColumnSchema... columns) {
        return new Schema(ImmutableList.copyOf(columns));
    }

    @JsonProperty("columns")
    public List<ColumnSchema> columns() {
        return columns;
    }

    public int numColumns() {
        return columns.size();
    }

    public ColumnSchema column(int index) {
        return columns.get(index);
    }

    @JsonIgnore
    public ColumnSchema keyColumn() {
        return columns.get(0);
    }

    /**
     * @return the position of the named column or -1
     */
    public int findColumn(String name) {
        Integer position = positions.get(name);
        return position == null ? -1 : position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((Schema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + columns;
    }
}
