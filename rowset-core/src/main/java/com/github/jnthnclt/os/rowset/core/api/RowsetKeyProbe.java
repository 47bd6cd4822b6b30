package com.github.jnthnclt.os.rowset.core.api;

import java.util.Arrays;

/**
 * A key to look up, together with its encoded bytes so they are computed once per probe.
 */
public class RowsetKeyProbe {

    private final ColumnType type;
    private final Object key;
    private final byte[] encodedKey;

    public RowsetKeyProbe(ColumnType type, Object key) {
        type.checkValue(key);
        this.type = type;
        this.key = key;
        this.encodedKey = type.encodeKey(key);
    }

    public static RowsetKeyProbe of(Schema schema, Object key) {
        return new RowsetKeyProbe(schema.keyColumn().type, key);
    }

    public ColumnType type() {
        return type;
    }

    public Object key() {
        return key;
    }

    public byte[] encodedKey() {
        return encodedKey;
    }

    @Override
    public String toString() {
        return "RowsetKeyProbe{" + "type=" + type + ", key=" + key + ", encodedKey=" + Arrays.toString(encodedKey) + '}';
    }
}
