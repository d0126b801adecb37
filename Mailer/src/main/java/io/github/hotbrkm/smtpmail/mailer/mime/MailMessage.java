package io.github.hotbrkm.smtpmail.mailer.mime;

import io.github.hotbrkm.smtpmail.mailer.send.DeliveryEnvelope;
import io.github.hotbrkm.smtpmail.mailer.send.MailDelivery;
import jakarta.mail.internet.MimeUtility;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A plain-text mail with optional file attachments, serialized to a MIME document once and then
 * sent over SMTP.
 * <p>
 * Instances are single-owner and not thread-safe. Setters may be called any number of times
 * before the first {@link #toBytes()} or {@link #send()}; the serialized form is cached after that.
 */
@Slf4j
public class MailMessage {

    public static final String DEFAULT_CONTENT_TYPE = "text/plain";
    public static final int DEFAULT_SMTP_PORT = 25;

    static final String SUBJECT_PREFIX = "smtp-mail - ";

    private static final String CRLF = "\r\n";
    private static final String CHARSET = "UTF-8";
    private static final DateTimeFormatter RFC_2822_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);

    @Getter
    private final String server;
    @Getter
    private final int port;
    @Getter
    private final String sender;
    @Getter
    private final List<String> recipients;
    @Getter
    private final boolean useTls;

    @Getter
    private String subject;
    @Getter
    private String contentType;

    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final Map<String, MailAttachment> attachments = new LinkedHashMap<>();
    private final AttachmentReader attachmentReader = new AttachmentReader();
    private final MailDelivery delivery;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    @Getter
    private boolean built;

    public MailMessage(String server, int port, String sender, List<String> recipients, boolean useTls) {
        this(server, port, sender, recipients, useTls, MailDelivery.withDefaults());
    }

    /**
     * @param server     SMTP server host, or {@code host:port}
     * @param port       SMTP port, 25 when not positive
     * @param sender     envelope sender
     * @param recipients envelope and {@code To:} recipients
     * @param useTls     upgrade with STARTTLS when the server offers it
     * @param delivery   SMTP transport used by {@link #send()}
     * @throws IllegalArgumentException if server, sender or recipients are missing
     */
    public MailMessage(String server, int port, String sender, List<String> recipients, boolean useTls,
                       MailDelivery delivery) {
        if (server == null || server.isEmpty()) {
            throw new IllegalArgumentException("SMTP server required");
        }
        if (sender == null || sender.isEmpty()) {
            throw new IllegalArgumentException("SMTP sender required");
        }
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("Mail recipient(s) required");
        }

        this.server = server;
        this.port = port > 0 ? port : DEFAULT_SMTP_PORT;
        this.sender = sender;
        this.recipients = List.copyOf(recipients);
        this.useTls = useTls;
        this.delivery = Objects.requireNonNull(delivery, "delivery must not be null");
        this.subject = SUBJECT_PREFIX + ZonedDateTime.now().format(RFC_2822_FORMATTER);
        setContentType("");
    }

    /**
     * Appends UTF-8 text to the body.
     */
    public void setBody(String data) {
        if (data != null && !data.isEmpty()) {
            body.writeBytes(data.getBytes(StandardCharsets.UTF_8));
        }
    }

    /**
     * Appends raw bytes to the body.
     */
    public void setBodyBytes(byte[] data) {
        if (data != null && data.length > 0) {
            body.writeBytes(data);
        }
    }

    /**
     * Sets the body content type. Empty resets to {@code text/plain}.
     */
    public void setContentType(String contentType) {
        if (contentType != null && !contentType.isEmpty()) {
            this.contentType = contentType;
        } else {
            this.contentType = DEFAULT_CONTENT_TYPE;
        }
    }

    public void setSubject(String subject) {
        if (subject != null && !subject.isEmpty()) {
            this.subject = subject;
        }
    }

    /**
     * Reads the file, base64 encodes it and stores it under the path's file name with a new boundary.
     * An attachment with the same file name is replaced. On failure earlier attachments are kept.
     *
     * @param pathToFile local file path
     * @throws IOException if the path is empty or the file cannot be read
     */
    public void addAttachment(String pathToFile) throws IOException {
        byte[] content = attachmentReader.read(pathToFile);
        String attachmentName = attachmentReader.fileName(pathToFile);

        byte[] encodedAttachment = Base64.getEncoder().encode(content);
        MailAttachment attachment = new MailAttachment(attachmentName, encodedAttachment,
                encodedAttachment.length, BoundaryGenerator.next());

        attachments.remove(attachmentName);
        attachments.put(attachmentName, attachment);
        log.debug("Attachment added - name={}, size={}, encodedSize={}", attachmentName, content.length, encodedAttachment.length);
    }

    public List<String> getAttachmentNames() {
        return new ArrayList<>(attachments.keySet());
    }

    /**
     * Returns the serialized message, building it on the first call.
     *
     * @return MIME document bytes
     * @throws MimeBuildException if the body is empty
     */
    public byte[] toBytes() {
        if (!built) {
            build();
        }
        return buffer.toByteArray();
    }

    /**
     * Serializes the message if needed and transmits it to the configured server.
     *
     * @throws MimeBuildException if the message cannot be serialized
     * @throws io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpDeliveryException if delivery fails
     */
    public void send() {
        byte[] content = toBytes();
        delivery.deliver(new DeliveryEnvelope(server, port, useTls, sender, recipients), content);
    }

    private void build() {
        if (body.size() == 0) {
            throw new MimeBuildException("Message body is empty");
        }

        StringBuilder header = new StringBuilder();
        header.append("To: ").append(String.join(", ", recipients)).append(CRLF);
        header.append("Subject: ").append(encodeSubject(subject)).append(CRLF);

        for (MailAttachment attachment : attachments.values()) {
            header.append("Content-Type: multipart/mixed; boundary=\"").append(attachment.boundary()).append('"').append(CRLF);
            header.append("--").append(attachment.boundary()).append(CRLF);
        }

        header.append("Content-Transfer-Encoding: base64").append(CRLF);
        header.append("MIME-Version: 1.0;").append(CRLF);
        header.append("Content-Type: ").append(contentType).append("; charset=\"utf-8\";").append(CRLF);
        header.append(CRLF);

        writeAscii(header);
        buffer.writeBytes(Base64.getEncoder().encode(body.toByteArray()));

        for (MailAttachment attachment : attachments.values()) {
            writeAttachment(attachment);
        }

        built = true;
        log.debug("Mail message built - recipients={}, attachments={}, size={}", recipients.size(), attachments.size(), buffer.size());
    }

    private void writeAttachment(MailAttachment attachment) {
        String name = attachment.name();

        StringBuilder part = new StringBuilder();
        part.append(CRLF).append(CRLF);
        part.append("--").append(attachment.boundary()).append(CRLF);
        part.append("Content-Type: application/octet-stream; name=\"").append(name).append('"').append(CRLF);
        part.append("Content-Description: ").append(name).append(CRLF);
        part.append("Content-Disposition: attachment; filename=\"").append(name).append("\"; size=")
                .append(attachment.encodedLength()).append(CRLF);
        part.append("Content-Transfer-Encoding: base64").append(CRLF);
        part.append(CRLF);

        writeAscii(part);
        buffer.writeBytes(attachment.encodedContent());
        writeAscii(new StringBuilder(CRLF).append("--").append(attachment.boundary()).append("--"));
    }

    private void writeAscii(CharSequence text) {
        buffer.writeBytes(text.toString().getBytes(StandardCharsets.UTF_8));
    }

    private String encodeSubject(String value) {
        try {
            return MimeUtility.fold(9, MimeUtility.encodeText(value, CHARSET, "B"));
        } catch (UnsupportedEncodingException e) {
            throw new MimeBuildException("Failed to encode subject", e);
        }
    }
}
