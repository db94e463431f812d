package org.crynn.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.crynn.storage.bookmark.BookmarkStore;
import org.crynn.storage.cache.CacheStore;
import org.crynn.storage.cache.CleanupResult;
import org.crynn.storage.config.StorageProperties;
import org.crynn.storage.cookie.CookieJar;
import org.crynn.storage.cookie.CookiePolicy;
import org.crynn.storage.history.HistoryStore;
import org.crynn.storage.index.StorageIndex;
import org.crynn.storage.mail.MailCache;
import org.crynn.storage.util.DataSizeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Facade over the local persistent store. Owns the shared index and builds every store on it.
 * <p>
 * This is the only class that knows about more than one store: it aggregates statistics and runs
 * the cleanup pass in a fixed order (cache, history, cookies, mail).
 */
public class StorageManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageManager.class);

    static final String DATABASE_NAME = "crynn";

    private final StorageIndex index;
    private final CacheStore cache;
    private final CookieJar cookies;
    private final HistoryStore history;
    private final BookmarkStore bookmarks;
    private final MailCache mail;

    public StorageManager(StorageIndex index, CacheStore cache, CookieJar cookies, HistoryStore history,
                          BookmarkStore bookmarks, MailCache mail) {
        this.index = Objects.requireNonNull(index, "index");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.cookies = Objects.requireNonNull(cookies, "cookies");
        this.history = Objects.requireNonNull(history, "history");
        this.bookmarks = Objects.requireNonNull(bookmarks, "bookmarks");
        this.mail = Objects.requireNonNull(mail, "mail");
    }

    public static StorageManager open(StorageProperties props) {
        return open(props, Clock.systemUTC());
    }

    /**
     * Creates the data directory, opens the index database and bootstraps its schema, then builds
     * the stores.
     *
     * @throws org.crynn.storage.index.SchemaException if the schema cannot be created or is newer than this build
     * @throws StorageIoException if the data directory cannot be created
     */
    public static StorageManager open(StorageProperties props, Clock clock) {
        Path dataDir = Paths.get(props.getDataDir()).toAbsolutePath().normalize();
        Path cacheDir = props.getCacheDir() == null || props.getCacheDir().isBlank()
                ? dataDir.resolve("cache")
                : Paths.get(props.getCacheDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create data directory: " + dataDir, e);
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("crynn-storage");
        cfg.setJdbcUrl("jdbc:h2:file:" + dataDir.resolve(DATABASE_NAME));
        cfg.setMaximumPoolSize(props.getPoolSize() <= 0 ? 4 : props.getPoolSize());
        HikariDataSource ds = new HikariDataSource(cfg);

        StorageIndex index = new StorageIndex(ds, dataDir.resolve(DATABASE_NAME + ".mv.db"));
        try {
            index.bootstrap();
            ObjectMapper mapper = new ObjectMapper();
            StorageManager manager = new StorageManager(
                    index,
                    new CacheStore(index, cacheDir, DataSizeParser.parseBytes(props.getCacheMaxSize()), clock),
                    new CookieJar(index, new CookiePolicy(props.isUpgradeSecureOnTls(), CookiePolicy.DOWNGRADE_SAME_SITE_NONE), clock),
                    new HistoryStore(index, props.getMaxHistoryItems(), clock),
                    new BookmarkStore(index, props.getMaxBookmarks(), clock, mapper),
                    new MailCache(index, DataSizeParser.parseBytes(props.getMailCacheMaxSize()), clock, mapper));
            log.info("Storage opened at {} (cache dir {})", dataDir, cacheDir);
            return manager;
        } catch (RuntimeException e) {
            index.close();
            throw e;
        }
    }

    public CacheStore cache() {
        return cache;
    }

    public CookieJar cookies() {
        return cookies;
    }

    public HistoryStore history() {
        return history;
    }

    public BookmarkStore bookmarks() {
        return bookmarks;
    }

    public MailCache mail() {
        return mail;
    }

    public StorageIndex index() {
        return index;
    }

    public StorageStats getStorageStats() {
        long total = index.indexFileSize() + directorySize(cache.cacheDir());
        return new StorageStats(
                cache.sizeBytes(),
                cache.count(),
                history.count(),
                bookmarks.count(),
                cookies.count(),
                mail.sizeBytes(),
                total);
    }

    /**
     * Runs every store's cleanup: cache, history, cookies, then mail. A failing store is logged
     * and recorded in the report; the remaining stores still run.
     */
    public CleanupReport cleanup() {
        Map<BrowsingDataKind, String> failures = new EnumMap<>(BrowsingDataKind.class);

        CleanupResult cacheResult = null;
        try {
            cacheResult = cache.cleanup();
        } catch (RuntimeException e) {
            recordFailure(failures, BrowsingDataKind.CACHE, e);
        }

        int historyRemoved = -1;
        try {
            historyRemoved = history.cleanup();
        } catch (RuntimeException e) {
            recordFailure(failures, BrowsingDataKind.HISTORY, e);
        }

        int cookiesRemoved = -1;
        try {
            cookiesRemoved = cookies.cleanup();
        } catch (RuntimeException e) {
            recordFailure(failures, BrowsingDataKind.COOKIES, e);
        }

        CleanupResult mailResult = null;
        try {
            mailResult = mail.cleanup();
        } catch (RuntimeException e) {
            recordFailure(failures, BrowsingDataKind.MAIL, e);
        }

        CleanupReport report = new CleanupReport(cacheResult, historyRemoved, cookiesRemoved, mailResult, failures);
        log.info("Storage cleanup finished (complete={})", report.isComplete());
        return report;
    }

    /** Wipes the selected kinds of data. */
    public void clearBrowsingData(Set<BrowsingDataKind> kinds) {
        for (BrowsingDataKind kind : kinds) {
            switch (kind) {
                case CACHE -> cache.clear();
                case COOKIES -> cookies.clear();
                case HISTORY -> history.clear();
                case BOOKMARKS -> bookmarks.clear();
                case MAIL -> mail.clear();
            }
        }
        log.info("Cleared browsing data: {}", kinds);
    }

    @Override
    public void close() {
        index.close();
    }

    private static void recordFailure(Map<BrowsingDataKind, String> failures, BrowsingDataKind kind, RuntimeException e) {
        log.warn("{} cleanup failed; continuing with the remaining stores", kind, e);
        failures.put(kind, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }

    static long directorySize(Path dir) {
        if (!Files.isDirectory(dir)) return 0L;
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile).mapToLong(StorageManager::sizeOrZero).sum();
        } catch (IOException e) {
            throw new StorageIoException("Failed to measure " + dir, e);
        } catch (UncheckedIOException e) {
            throw new StorageIoException("Failed to measure " + dir, e.getCause());
        }
    }

    // A blob may be evicted between the walk and the stat.
    private static long sizeOrZero(Path file) {
        try {
            return Files.size(file);
        } catch (NoSuchFileException e) {
            return 0L;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
