package com.github.jnthnclt.os.rowset.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jnthnclt.os.rowset.core.api.Schema;
import com.github.jnthnclt.os.rowset.core.api.exceptions.RowsetCorruptedException;
import com.github.jnthnclt.os.rowset.core.guts.ColumnFileSet;
import com.github.jnthnclt.os.rowset.log.RowsetLogger;
import com.github.jnthnclt.os.rowset.log.RowsetLoggerFactory;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.File;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Where a rowset's files live and the shared resources every opened rowset uses.
 *
 * @author jonathan.colt
 */
public class RowsetEnvironment {

    private static final RowsetLogger LOG = RowsetLoggerFactory.getLogger();

    public static final String SCHEMA_FILE_NAME = "schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private final RowsetStats stats;
    private final RowsetConfig config;
    private final ExecutorService destroy;

    public static ExecutorService buildRowsetDestroyThreadPool(int count) {
        return Executors.newFixedThreadPool(count, new ThreadFactoryBuilder().setNameFormat("rowset-destroy-%d").setDaemon(true).build());
    }

    public RowsetEnvironment(RowsetStats stats, RowsetConfig config, ExecutorService destroy) {
        this.stats = stats;
        this.config = config;
        this.destroy = destroy;
    }

    public RowsetStats stats() {
        return stats;
    }

    public RowsetConfig config() {
        return config;
    }

    public ExecutorService destroy() {
        return destroy;
    }

    public File columnFile(File rowsetDir, int column) {
        return new File(rowsetDir, config.columnFilePrefix + column);
    }

    public File bloomFile(File rowsetDir) {
        return new File(rowsetDir, config.bloomFileName);
    }

    /**
     * Opens every column of the rowset in {@code rowsetDir}.
     */
    public ColumnFileSet open(File rowsetDir, Schema schema) throws IOException, RowsetCorruptedException {
        ColumnFileSet columnFileSet = new ColumnFileSet(this, rowsetDir, schema);
        columnFileSet.openAllColumns();
        return columnFileSet;
    }

    /**
     * Opens only the key column, enough for lookups and existence checks.
     */
    public ColumnFileSet openKeys(File rowsetDir, Schema schema) throws IOException, RowsetCorruptedException {
        ColumnFileSet columnFileSet = new ColumnFileSet(this, rowsetDir, schema);
        columnFileSet.openKeyColumns();
        return columnFileSet;
    }

    public void writeSchema(File rowsetDir, Schema schema) throws IOException {
        MAPPER.writeValue(new File(rowsetDir, SCHEMA_FILE_NAME), schema);
    }

    public Schema readSchema(File rowsetDir) throws IOException {
        File schemaFile = new File(rowsetDir, SCHEMA_FILE_NAME);
        if (!schemaFile.exists()) {
            throw new IOException("There is no schema for rowset:" + rowsetDir);
        }
        return MAPPER.readValue(schemaFile, Schema.class);
    }

    public static RowsetConfig readConfig(File configFile) throws IOException {
        RowsetConfig config = MAPPER.readValue(configFile, RowsetConfig.class);
        LOG.info("Loaded {} from {}", config, configFile);
        return config;
    }

    public static void writeConfig(File configFile, RowsetConfig config) throws IOException {
        MAPPER.writeValue(configFile, config);
    }

    public void shutdown() {
        destroy.shutdown();
    }

    @Override
    public String toString() {
        return "RowsetEnvironment{" + "config=" + config + '}';
    }
}
