package io.github.hotbrkm.smtpmail.mailer.send;

import io.github.hotbrkm.smtpmail.mailer.send.transport.network.ServerAddress;

import java.util.List;

/**
 * SMTP-level routing of one message: where to connect and the MAIL FROM / RCPT TO addresses.
 */
public record DeliveryEnvelope(String server, int port, boolean useTls, String sender, List<String> recipients) {

    public DeliveryEnvelope {
        recipients = List.copyOf(recipients);
    }

    /**
     * The configured server when it already carries a port, otherwise {@code server:port}.
     */
    public String dialAddress() {
        return ServerAddress.toDialAddress(server, port);
    }

    /**
     * Host part of the dial address, used as the TLS server name.
     */
    public String serverName() {
        return ServerAddress.parse(dialAddress()).getHost();
    }
}
