package org.crynn.storage.history;

import org.crynn.storage.testsupport.MutableClock;
import org.crynn.storage.testsupport.TestIndexes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryStoreTest {

    private MutableClock clock;
    private HistoryStore history;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        history = new HistoryStore(TestIndexes.inMemory(), 100, clock);
    }

    @Test
    void firstVisitInsertsRow() {
        HistoryItem item = history.recordVisit("https://example.com/", "Example");

        assertEquals(1, item.visitCount());
        assertEquals("Example", item.title());
        assertEquals(clock.instant(), item.lastVisit());
        assertEquals(clock.instant(), item.createdAt());
    }

    @Test
    void repeatVisitBumpsCountAndLastVisitButKeepsCreatedAt() {
        Instant first = clock.instant();
        history.recordVisit("https://example.com/", "Example");
        clock.advanceSeconds(90);

        HistoryItem item = history.recordVisit("https://example.com/", null);

        assertEquals(2, item.visitCount());
        assertEquals("Example", item.title(), "null title keeps the stored one");
        assertEquals(clock.instant(), item.lastVisit());
        assertEquals(first, item.createdAt());
        assertEquals(1, history.count());
    }

    @Test
    void newTitleReplacesOldOne() {
        history.recordVisit("https://example.com/", "Old");
        assertEquals("New", history.recordVisit("https://example.com/", "New").title());
    }

    @Test
    void cleanupKeepsMostRecentlyVisited() {
        HistoryStore capped = new HistoryStore(TestIndexes.inMemory(), 2, clock);
        capped.recordVisit("https://a.test/", "a");
        clock.advanceSeconds(1);
        capped.recordVisit("https://b.test/", "b");
        clock.advanceSeconds(1);
        capped.recordVisit("https://c.test/", "c");

        assertEquals(1, capped.cleanup());

        assertEquals(2, capped.count());
        assertTrue(capped.get("https://a.test/").isEmpty());
        assertTrue(capped.get("https://b.test/").isPresent());
        assertTrue(capped.get("https://c.test/").isPresent());
    }

    @Test
    void revisitMovesUrlToTheBackOfTheEvictionQueue() {
        HistoryStore capped = new HistoryStore(TestIndexes.inMemory(), 2, clock);
        capped.recordVisit("https://a.test/", "a");
        clock.advanceSeconds(1);
        capped.recordVisit("https://b.test/", "b");
        clock.advanceSeconds(1);
        capped.recordVisit("https://c.test/", "c");
        clock.advanceSeconds(1);
        capped.recordVisit("https://a.test/", "a");

        capped.cleanup();

        assertTrue(capped.get("https://a.test/").isPresent());
        assertTrue(capped.get("https://b.test/").isEmpty());
    }

    @Test
    void cleanupIsIdempotentAndNoOpUnderCap() {
        history.recordVisit("https://a.test/", "a");

        assertEquals(0, history.cleanup());
        assertEquals(0, history.cleanup());
        assertEquals(1, history.count());
    }

    @Test
    void recentIsNewestFirst() {
        history.recordVisit("https://a.test/", "a");
        clock.advanceSeconds(1);
        history.recordVisit("https://b.test/", "b");
        clock.advanceSeconds(1);
        history.recordVisit("https://c.test/", "c");

        List<HistoryItem> recent = history.recent(2);

        assertEquals(List.of("https://c.test/", "https://b.test/"), recent.stream().map(HistoryItem::url).toList());
    }

    @Test
    void searchMatchesUrlOrTitleCaseInsensitively() {
        history.recordVisit("https://docs.example.com/guide", "User Guide");
        history.recordVisit("https://news.test/", "Daily NEWS");
        history.recordVisit("https://other.test/100%_done", "Progress");

        assertEquals(1, history.search("GUIDE", 10).size());
        assertEquals(1, history.search("news", 10).size());
        assertEquals(1, history.search("100%_", 10).size());
        assertEquals(0, history.search("100%x", 10).size());
        assertEquals(3, history.search("  ", 10).size());
    }

    @Test
    void snapshotIsImmutableAndLeavesStoreUntouched() {
        history.recordVisit("https://a.test/", "a");
        clock.advanceSeconds(1);
        history.recordVisit("https://b.test/", "b");

        List<HistoryItem> snapshot = history.snapshot();

        assertEquals(2, snapshot.size());
        assertEquals("https://a.test/", snapshot.get(0).url());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
        assertEquals(2, history.count());
        assertEquals(1, history.get("https://a.test/").orElseThrow().visitCount());
    }

    @Test
    void removeAndClear() {
        history.recordVisit("https://a.test/", "a");
        history.recordVisit("https://b.test/", "b");

        assertTrue(history.remove("https://a.test/"));
        assertFalse(history.remove("https://a.test/"));
        assertEquals(1, history.clear());
        assertEquals(0, history.count());
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryStore(TestIndexes.inMemory(), 0, clock));
    }
}
