package com.github.jnthnclt.os.rowset.core.api.exceptions;

/**
 *
 * @author jonathan.colt
 */
public class RowsetCorruptedException extends Exception {

    public RowsetCorruptedException() {
    }

    public RowsetCorruptedException(String message) {
        super(message);
    }

    public RowsetCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
