package com.github.jnthnclt.os.rowset.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * @author jonathan.colt
 */
public class ColumnSchema {

    public final String name;
    public final ColumnType type;

    @JsonCreator
    public ColumnSchema(@JsonProperty("name") String name,
        @JsonProperty("type") ColumnType type) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Column name is required");
        Preconditions.checkNotNull(type, "Column %s requires a type", name);
        this.name = name;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnSchema that = (ColumnSchema) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "[" + type + "]";
    }
}
