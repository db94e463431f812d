package org.crynn.storage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the browser's local data store.
 * <p>
 * Sizes are size expressions as accepted by {@link org.crynn.storage.util.DataSizeParser},
 * e.g. {@code 100MB}, {@code 64MiB} or {@code 4*1024}.
 */
@ConfigurationProperties(prefix = "crynn.storage")
public class StorageProperties {

    /** Directory holding the index database and, by default, the cache blobs. */
    private String dataDir = "./data/crynn";

    /** Blob directory of the resource cache. Defaults to {@code <dataDir>/cache}. */
    private String cacheDir;

    private String cacheMaxSize = "100MB";

    private String mailCacheMaxSize = "50MB";

    private int maxHistoryItems = 10_000;

    private int maxBookmarks = 1_000;

    /** Store cookies received over https as secure even when the server did not say so. */
    private boolean upgradeSecureOnTls = true;

    /** Connections in the index pool. */
    private int poolSize = 4;

    private final Cleanup cleanup = new Cleanup();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(String cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public String getMailCacheMaxSize() {
        return mailCacheMaxSize;
    }

    public void setMailCacheMaxSize(String mailCacheMaxSize) {
        this.mailCacheMaxSize = mailCacheMaxSize;
    }

    public int getMaxHistoryItems() {
        return maxHistoryItems;
    }

    public void setMaxHistoryItems(int maxHistoryItems) {
        this.maxHistoryItems = maxHistoryItems;
    }

    public int getMaxBookmarks() {
        return maxBookmarks;
    }

    public void setMaxBookmarks(int maxBookmarks) {
        this.maxBookmarks = maxBookmarks;
    }

    public boolean isUpgradeSecureOnTls() {
        return upgradeSecureOnTls;
    }

    public void setUpgradeSecureOnTls(boolean upgradeSecureOnTls) {
        this.upgradeSecureOnTls = upgradeSecureOnTls;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Cleanup {

        /** Run the periodic cleanup pass. */
        private boolean enabled = true;

        /** Delay between the end of one pass and the start of the next. */
        private long intervalMs = 900_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
