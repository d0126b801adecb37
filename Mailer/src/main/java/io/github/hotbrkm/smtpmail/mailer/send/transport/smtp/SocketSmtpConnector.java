package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import io.github.hotbrkm.smtpmail.mailer.send.transport.network.ServerAddress;
import io.github.hotbrkm.smtpmail.mailer.send.transport.network.SocketConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Dials SMTP servers with a fresh {@link SmtpClient} per connection.
 */
@Slf4j
@Getter
public class SocketSmtpConnector implements SmtpConnector {

    public static final String DEFAULT_HELO = "localhost";

    private final SocketConfig socketConfig;
    private final String helo;
    private final boolean traceLog;

    public SocketSmtpConnector(SocketConfig socketConfig, String helo, boolean traceLog) {
        this.socketConfig = socketConfig;
        this.helo = helo == null || helo.isBlank() ? DEFAULT_HELO : helo;
        this.traceLog = traceLog;
    }

    public static SocketSmtpConnector withDefaults() {
        return new SocketSmtpConnector(SocketConfig.defaults(), DEFAULT_HELO, false);
    }

    @Override
    public SmtpConnection dial(String address) {
        ServerAddress serverAddress = ServerAddress.parse(address);
        SmtpClient smtpClient = new SmtpClient(socketConfig, helo, traceLog);

        try {
            smtpClient.connect(serverAddress);
        } catch (RuntimeException e) {
            smtpClient.closeSession();
            throw e;
        }

        log.debug("Connected to SMTP server {}", serverAddress);
        return smtpClient;
    }
}
