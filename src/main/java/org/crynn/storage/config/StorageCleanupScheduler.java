package org.crynn.storage.config;

import org.crynn.storage.CleanupReport;
import org.crynn.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic storage cleanup. Disable with {@code crynn.storage.cleanup.enabled=false}. */
@Component
@ConditionalOnProperty(prefix = "crynn.storage.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StorageCleanupScheduler {
    private static final Logger log = LoggerFactory.getLogger(StorageCleanupScheduler.class);

    private final StorageManager storageManager;

    public StorageCleanupScheduler(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Scheduled(initialDelayString = "${crynn.storage.cleanup.interval-ms:900000}",
            fixedDelayString = "${crynn.storage.cleanup.interval-ms:900000}")
    public void runCleanup() {
        CleanupReport report = storageManager.cleanup();
        if (!report.isComplete()) {
            log.warn("Scheduled storage cleanup had failures: {}", report.failures());
        }
    }
}
