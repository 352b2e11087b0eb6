package com.bsl.bankcode.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval.index")
public class IndexProperties {
    private int batchSize = 100;
    private boolean buildOnStartup = true;
    private int rebuildPoolSize = 1;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isBuildOnStartup() {
        return buildOnStartup;
    }

    public void setBuildOnStartup(boolean buildOnStartup) {
        this.buildOnStartup = buildOnStartup;
    }

    public int getRebuildPoolSize() {
        return rebuildPoolSize;
    }

    public void setRebuildPoolSize(int rebuildPoolSize) {
        this.rebuildPoolSize = rebuildPoolSize;
    }
}
