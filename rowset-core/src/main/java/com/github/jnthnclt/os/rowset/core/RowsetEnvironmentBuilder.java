package com.github.jnthnclt.os.rowset.core;

import java.util.concurrent.ExecutorService;

public class RowsetEnvironmentBuilder {

    public RowsetStats stats = null;
    public RowsetConfig config = RowsetConfig.DEFAULT;
    public ExecutorService destroy = null;
    public int destroyThreads = 1;

    public RowsetEnvironment build() {
        return new RowsetEnvironment(stats != null ? stats : new RowsetStats(),
            config,
            destroy != null ? destroy : RowsetEnvironment.buildRowsetDestroyThreadPool(destroyThreads));
    }

    public RowsetEnvironmentBuilder setStats(RowsetStats stats) {
        this.stats = stats;
        return this;
    }

    public RowsetEnvironmentBuilder setConfig(RowsetConfig config) {
        this.config = config;
        return this;
    }

    public RowsetEnvironmentBuilder setDestroy(ExecutorService destroy) {
        this.destroy = destroy;
        return this;
    }

    public RowsetEnvironmentBuilder setDestroyThreads(int destroyThreads) {
        this.destroyThreads = destroyThreads;
        return this;
    }
}
