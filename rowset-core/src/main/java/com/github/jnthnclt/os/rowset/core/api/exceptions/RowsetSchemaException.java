package com.github.jnthnclt.os.rowset.core.api.exceptions;

/**
 *
 * @author jonathan.colt
 */
public class RowsetSchemaException extends Exception {

    public RowsetSchemaException() {
    }

    public RowsetSchemaException(String message) {
        super(message);
    }

    public RowsetSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
