package org.crynn.storage.mail;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.crynn.storage.cache.CleanupResult;
import org.crynn.storage.index.StorageIndex;
import org.crynn.storage.testsupport.MutableClock;
import org.crynn.storage.testsupport.TestIndexes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailCacheTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StorageIndex index;
    private MutableClock clock;
    private MailCache mail;

    @BeforeEach
    void setUp() {
        index = TestIndexes.inMemory();
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        mail = new MailCache(index, 10_000, clock, mapper);
    }

    private static MailHeader header(long uid, String subject, long size) {
        return new MailHeader(uid, subject, "alice@example.com", "bob@example.com",
                Instant.parse("2024-04-01T00:00:00Z").plusSeconds(uid), size, List.of("\\Seen"), "INBOX");
    }

    @Test
    void storeHeadersThenGet() {
        mail.storeHeaders(List.of(header(1, "Hello", 100), header(2, "Invoice", 200)));

        MailHeader h = mail.getHeader(1).orElseThrow();
        assertEquals("Hello", h.subject());
        assertEquals(List.of("\\Seen"), h.flags());
        assertEquals(300, mail.sizeBytes());
        assertEquals(2, mail.count());
    }

    @Test
    void restoringHeaderAdjustsSizeByDifference() {
        mail.storeHeaders(List.of(header(1, "Hello", 100)));
        mail.storeHeaders(List.of(header(1, "Hello (edited)", 40)));

        assertEquals(40, mail.sizeBytes());
        assertEquals("Hello (edited)", mail.getHeader(1).orElseThrow().subject());
    }

    @Test
    void storeBodyWithAttachments() {
        byte[] pdf = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);
        mail.storeHeaders(List.of(header(7, "Report", 50)));
        mail.storeBody(new MailBody(7, "See attached.", "text/plain",
                List.of(MailAttachment.of("report.pdf", "application/pdf", pdf))));

        MailBody body = mail.getBody(7).orElseThrow();

        assertEquals("See attached.", body.content());
        assertEquals(1, body.attachments().size());
        assertArrayEquals(pdf, body.attachments().get(0).data());
        assertEquals(50 + pdf.length, mail.sizeBytes());
    }

    @Test
    void restoringBodyReplacesAttachments() {
        mail.storeBody(new MailBody(3, "v1", "text/plain",
                List.of(MailAttachment.of("a.bin", "application/octet-stream", new byte[100]))));
        mail.storeBody(new MailBody(3, "v2", "text/plain", List.of()));

        assertEquals("v2", mail.getBody(3).orElseThrow().content());
        assertTrue(mail.getBody(3).orElseThrow().attachments().isEmpty());
        assertEquals(0, mail.sizeBytes());
    }

    @Test
    void missingBodyIsEmpty() {
        assertTrue(mail.getBody(42).isEmpty());
        assertTrue(mail.getHeader(42).isEmpty());
    }

    @Test
    void searchMatchesSubjectSenderOrRecipientNewestFirst() {
        mail.storeHeaders(List.of(
                header(1, "Quarterly invoice", 10),
                header(2, "Lunch?", 10),
                header(3, "Invoice overdue", 10)));

        List<MailHeader> found = mail.searchHeaders("INVOICE");

        assertEquals(List.of(3L, 1L), found.stream().map(MailHeader::uid).toList());
        assertEquals(3, mail.searchHeaders("alice").size());
        assertEquals(3, mail.searchHeaders("").size());
    }

    @Test
    void overBudgetEvictsWholeMessagesOldestCachedFirst() {
        MailCache small = new MailCache(index, 250, clock, mapper);
        small.storeHeaders(List.of(header(1, "one", 100)));
        small.storeBody(new MailBody(1, "body one", "text/plain",
                List.of(MailAttachment.of("x.bin", "application/octet-stream", new byte[50]))));
        clock.advanceSeconds(1);
        small.storeHeaders(List.of(header(2, "two", 100)));
        clock.advanceSeconds(1);
        small.storeHeaders(List.of(header(3, "three", 100)));

        assertTrue(small.getHeader(1).isEmpty());
        assertTrue(small.getBody(1).isEmpty(), "body and attachments go with the header");
        assertTrue(small.getHeader(2).isPresent());
        assertTrue(small.getHeader(3).isPresent());
        assertEquals(200, small.sizeBytes());
    }

    @Test
    void cleanupResyncsCounterAndIsIdempotent() {
        mail.storeHeaders(List.of(header(1, "a", 4_000), header(2, "b", 4_000)));
        clock.advanceSeconds(1);
        mail.storeHeaders(List.of(header(3, "c", 1_000)));

        MailCache reopened = new MailCache(index, 4_999, clock, mapper);
        CleanupResult first = reopened.cleanup();
        CleanupResult second = reopened.cleanup();

        assertEquals(2, first.evicted());
        assertEquals(8_000, first.bytesFreed());
        assertEquals(1_000, reopened.sizeBytes());
        assertEquals(0, second.removed());
    }

    @Test
    void removeAndClear() {
        mail.storeHeaders(List.of(header(1, "a", 10), header(2, "b", 20)));

        assertTrue(mail.remove(1));
        assertFalse(mail.remove(1));
        assertEquals(20, mail.sizeBytes());

        assertEquals(1, mail.clear());
        assertEquals(0, mail.sizeBytes());
        assertEquals(0, mail.count());
    }
}
