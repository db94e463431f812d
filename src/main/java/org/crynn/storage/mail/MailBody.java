package org.crynn.storage.mail;

import java.util.List;

public record MailBody(long uid, String content, String contentType, List<MailAttachment> attachments) {
    public MailBody {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public long attachmentBytes() {
        return attachments.stream().mapToLong(MailAttachment::sizeBytes).sum();
    }
}
