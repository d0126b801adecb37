package io.github.hotbrkm.smtpmail.mailer.send;

import io.github.hotbrkm.smtpmail.mailer.mime.MailMessage;
import lombok.Getter;

import java.util.List;

/**
 * Creates messages bound to one SMTP server and a shared {@link MailDelivery}.
 */
@Getter
public class MailMessageFactory {

    private final String server;
    private final int port;
    private final boolean useTls;
    private final MailDelivery delivery;

    public MailMessageFactory(String server, int port, boolean useTls, MailDelivery delivery) {
        this.server = server;
        this.port = port;
        this.useTls = useTls;
        this.delivery = delivery;
    }

    /**
     * @throws IllegalArgumentException if the server is not configured or sender/recipients are missing
     */
    public MailMessage create(String sender, List<String> recipients) {
        return new MailMessage(server, port, sender, recipients, useTls, delivery);
    }
}
