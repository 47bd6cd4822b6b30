package com.github.jnthnclt.os.rowset.core.io;

import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;

/**
 * Unmaps memory mapped buffers eagerly instead of waiting on the garbage collector.
 */
class DirectBufferCleaner {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    private static final Object unsafe;
    private static final Method invokeCleanerMethod;
    private static final boolean available;

    static {
        Object _unsafe = null;
        Method _invokeCleanerMethod = null;
        boolean _available = false;
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field theUnsafe = unsafeClass.getDeclaredField("theUnsafe");
            theUnsafe.setAccessible(true);
            _unsafe = theUnsafe.get(null);
            _invokeCleanerMethod = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
            _available = true;
        } catch (ClassNotFoundException | NoSuchFieldException | NoSuchMethodException | IllegalAccessException | RuntimeException e) {
            LOG.warn("Failed to reflect direct buffer cleaner, mapped buffers will be released by the garbage collector.", e);
        }
        unsafe = _unsafe;
        invokeCleanerMethod = _invokeCleanerMethod;
        available = _available;
    }

    static public void clean(ByteBuffer bb) {
        if (available && bb.isDirect()) {
            try {
                invokeCleanerMethod.invoke(unsafe, bb);
            } catch (IllegalAccessException | IllegalArgumentException | InvocationTargetException e) {
                LOG.warn("Failed to clean buffer:" + bb, e);
            }
        }
    }
}
