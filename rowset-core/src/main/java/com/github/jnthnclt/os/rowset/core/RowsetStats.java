package com.github.jnthnclt.os.rowset.core;

import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.LongAdder;
import javax.management.InstanceAlreadyExistsException;
import javax.management.InstanceNotFoundException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;

/**
 *
 * @author jonathan.colt
 */
public class RowsetStats {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    public final LongAdder open = new LongAdder();
    public final LongAdder closed = new LongAdder();
    public final LongAdder columnsOpened = new LongAdder();
    public final LongAdder bloomFiltersOpened = new LongAdder();

    public final LongAdder blocksRead = new LongAdder();
    public final LongAdder bytesRead = new LongAdder();

    public final LongAdder findRow = new LongAdder();
    public final LongAdder checkRowPresent = new LongAdder();
    public final LongAdder bloomProbes = new LongAdder();
    public final LongAdder bloomAbsent = new LongAdder();

    public final LongAdder iterators = new LongAdder();
    public final LongAdder batches = new LongAdder();
    public final LongAdder rowsPrepared = new LongAdder();
    public final LongAdder columnsMaterialized = new LongAdder();

    public RowsetStats() {

        register("files>open", new LongCounter(open));
        register("files>closed", new LongCounter(closed));
        register("files>columnsOpened", new LongCounter(columnsOpened));
        register("files>bloomFiltersOpened", new LongCounter(bloomFiltersOpened));

        register("io>blocksRead", new LongCounter(blocksRead));
        register("io>bytesRead", new LongCounter(bytesRead));

        register("read>findRow", new LongCounter(findRow));
        register("read>checkRowPresent", new LongCounter(checkRowPresent));
        register("read>bloomProbes", new LongCounter(bloomProbes));
        register("read>bloomAbsent", new LongCounter(bloomAbsent));

        register("scan>iterators", new LongCounter(iterators));
        register("scan>batches", new LongCounter(batches));
        register("scan>rowsPrepared", new LongCounter(rowsPrepared));
        register("scan>columnsMaterialized", new LongCounter(columnsMaterialized));
    }

    public class LongCounter implements RowsetCounterMXBean {
        private final Number number;

        public LongCounter(Number number) {
            this.number = number;
        }

        @Override
        public long getValue() {
            return number.longValue();
        }

        @Override
        public String getType() {
            return "count";
        }
    }

    public interface RowsetCounterMXBean {

        long getValue();

        String getType();

    }

    private static void register(String name, Object mbean) {
        name = name.replace(':', '_');

        String[] parts = name.split(">");

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i != 0) {
                sb.append(",");
            }
            sb.append("leaf");
            sb.append(i);
            sb.append("=");
            sb.append(parts[i]);
        }

        String objectName = "rowset.metrics:type=" + mbean.getClass().getSimpleName() + "," + sb;

        LOG.debug("registering bean: {}", objectName);

        MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();

        try {
            ObjectName mbeanName = new ObjectName(objectName);

            // a newer stats instance replaces the previous one
            if (mbs.isRegistered(mbeanName)) {
                mbs.unregisterMBean(mbeanName);
            }

            mbs.registerMBean(mbean, mbeanName);

            LOG.debug("registered bean: {}", objectName);
        } catch (MalformedObjectNameException | NotCompliantMBeanException |
            InstanceAlreadyExistsException | InstanceNotFoundException | MBeanRegistrationException e) {
            LOG.warn("unable to register bean: " + objectName + " cause: " + e.getMessage(), e);
        }
    }

}
