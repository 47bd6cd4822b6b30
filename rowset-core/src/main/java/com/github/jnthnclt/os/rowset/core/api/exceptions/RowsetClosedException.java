package com.github.jnthnclt.os.rowset.core.api.exceptions;

/**
 *
 * @author jonathan.colt
 */
public class RowsetClosedException extends Exception {

    public RowsetClosedException() {
    }

    public RowsetClosedException(String message) {
        super(message);
    }

    public RowsetClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
