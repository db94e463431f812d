package org.crynn.storage.config;

import org.crynn.storage.StorageManager;
import org.crynn.storage.bookmark.BookmarkStore;
import org.crynn.storage.cache.CacheStore;
import org.crynn.storage.cookie.CookieJar;
import org.crynn.storage.history.HistoryStore;
import org.crynn.storage.mail.MailCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock storageClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public StorageManager storageManager(StorageProperties props, Clock storageClock) {
        return StorageManager.open(props, storageClock);
    }

    @Bean
    public CacheStore cacheStore(StorageManager storageManager) {
        return storageManager.cache();
    }

    @Bean
    public CookieJar cookieJar(StorageManager storageManager) {
        return storageManager.cookies();
    }

    @Bean
    public HistoryStore historyStore(StorageManager storageManager) {
        return storageManager.history();
    }

    @Bean
    public BookmarkStore bookmarkStore(StorageManager storageManager) {
        return storageManager.bookmarks();
    }

    @Bean
    public MailCache mailCache(StorageManager storageManager) {
        return storageManager.mail();
    }
}
