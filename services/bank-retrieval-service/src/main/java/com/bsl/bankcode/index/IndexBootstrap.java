package com.bsl.bankcode.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class IndexBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexBootstrap.class);

    private final IndexSyncManager indexSyncManager;
    private final IndexProperties properties;

    public IndexBootstrap(IndexSyncManager indexSyncManager, IndexProperties properties) {
        this.indexSyncManager = indexSyncManager;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void buildOnStartup() {
        if (!properties.isBuildOnStartup()) {
            logger.info("index_startup_build_disabled");
            return;
        }
        indexSyncManager.rebuildAsync(false).whenComplete((built, error) -> {
            if (error != null) {
                logger.error("index_startup_build_failed reason={}", error.getMessage(), error);
            } else {
                logger.info("index_startup_build_finished built={}", built);
            }
        });
    }
}
