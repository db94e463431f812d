package org.crynn.storage.mail;

import java.time.Instant;
import java.util.List;

/**
 * Envelope of one cached message. {@code sizeBytes} is the message size reported by the server
 * and counts toward the mail cache budget.
 */
public record MailHeader(
        long uid,
        String subject,
        String from,
        String to,
        Instant date,
        long sizeBytes,
        List<String> flags,
        String folder
) {
    public MailHeader {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
