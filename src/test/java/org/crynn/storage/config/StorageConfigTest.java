package org.crynn.storage.config;

import org.crynn.storage.StorageManager;
import org.crynn.storage.bookmark.BookmarkStore;
import org.crynn.storage.cache.CacheStore;
import org.crynn.storage.cookie.CookieJar;
import org.crynn.storage.history.HistoryStore;
import org.crynn.storage.mail.MailCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DirtiesContext
class StorageConfigTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storageProps(DynamicPropertyRegistry registry) {
        registry.add("crynn.storage.data-dir", () -> dataDir.toString());
        registry.add("crynn.storage.cache-max-size", () -> "2MiB");
        registry.add("crynn.storage.max-history-items", () -> "50");
    }

    @Autowired
    StorageProperties props;

    @Autowired
    StorageManager storageManager;

    @Autowired
    CacheStore cacheStore;

    @Autowired
    CookieJar cookieJar;

    @Autowired
    HistoryStore historyStore;

    @Autowired
    BookmarkStore bookmarkStore;

    @Autowired
    MailCache mailCache;

    @Autowired
    StorageCleanupScheduler scheduler;

    @Test
    void bindsPropertiesAndExposesStores() {
        assertThat(props.getMaxHistoryItems()).isEqualTo(50);
        assertThat(props.getCleanup().isEnabled()).isTrue();
        assertThat(cacheStore).isSameAs(storageManager.cache());
        assertThat(cacheStore.maxSizeBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(historyStore.maxItems()).isEqualTo(50);
        assertThat(cookieJar.policy().upgradeSecureOnTls()).isTrue();
        assertThat(mailCache.maxSizeBytes()).isEqualTo(50L * 1024 * 1024);
        assertThat(bookmarkStore).isSameAs(storageManager.bookmarks());
    }

    @Test
    void scheduledCleanupRunsAgainstTheManager() {
        historyStore.recordVisit("https://example.com/", "Example");

        scheduler.runCleanup();

        assertThat(historyStore.count()).isEqualTo(1);
    }
}
