package org.crynn.storage.mail;

public record MailAttachment(String filename, String contentType, long sizeBytes, byte[] data) {

    public static MailAttachment of(String filename, String contentType, byte[] data) {
        return new MailAttachment(filename, contentType, data.length, data);
    }
}
