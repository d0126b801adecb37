package io.github.hotbrkm.smtpmail.mailer.mime;

import java.util.Objects;

/**
 * Attachment ready for serialization.
 *
 * @param name           base file name of the source path
 * @param encodedContent base64 of the file content
 * @param encodedLength  length of {@code encodedContent}, written as the {@code size} parameter
 * @param boundary       boundary token owned by this attachment
 */
public record MailAttachment(String name, byte[] encodedContent, int encodedLength, String boundary) {
    public MailAttachment {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(encodedContent, "encodedContent must not be null");
        Objects.requireNonNull(boundary, "boundary must not be null");
    }
}
