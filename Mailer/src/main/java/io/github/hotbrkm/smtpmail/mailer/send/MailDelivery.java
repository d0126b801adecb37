package io.github.hotbrkm.smtpmail.mailer.send;

import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommand;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommandResponse;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpConnection;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpConnector;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpDeliveryException;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpTlsConfig;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SocketSmtpConnector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Runs one SMTP transaction for a serialized message: dial, optional STARTTLS, MAIL, RCPT for
 * each recipient, DATA, QUIT.
 * <p>
 * The first failure ends the transaction. After a failure past dial the connection gets a
 * best-effort RSET and QUIT, then the original {@link SmtpDeliveryException} is rethrown.
 * A failed TLS handshake is fatal; a server that does not offer STARTTLS is used in plaintext.
 */
@Slf4j
public class MailDelivery {

    static final String STARTTLS_EXTENSION = "STARTTLS";

    @Getter
    private final SmtpConnector connector;
    private final String[] enabledTlsProtocols;
    private final boolean trustAllCertificates;

    public MailDelivery(SmtpConnector connector) {
        this(connector, new String[0], true);
    }

    public MailDelivery(SmtpConnector connector, String[] enabledTlsProtocols, boolean trustAllCertificates) {
        this.connector = connector;
        this.enabledTlsProtocols = enabledTlsProtocols == null ? new String[0] : enabledTlsProtocols.clone();
        this.trustAllCertificates = trustAllCertificates;
    }

    /**
     * Plain sockets without timeouts, HELO name {@code localhost}, certificate checks disabled.
     */
    public static MailDelivery withDefaults() {
        return new MailDelivery(SocketSmtpConnector.withDefaults());
    }

    /**
     * Transmits the message.
     *
     * @param envelope routing and envelope addresses
     * @param content  serialized message
     * @throws SmtpDeliveryException the first failure reported by the SMTP server or the connection
     */
    public void deliver(DeliveryEnvelope envelope, byte[] content) {
        SmtpConnection connection = connector.dial(envelope.dialAddress());

        try {
            if (envelope.useTls() && connection.supportsExtension(STARTTLS_EXTENSION)) {
                connection.startTls(new SmtpTlsConfig(List.of(enabledTlsProtocols), trustAllCertificates, envelope.serverName()));
            } else if (envelope.useTls()) {
                log.debug("{} does not offer STARTTLS, sending without TLS", envelope.dialAddress());
            }

            connection.mail(envelope.sender());
            for (String recipient : envelope.recipients()) {
                connection.rcpt(recipient);
            }

            writeContent(connection.data(), content);
        } catch (RuntimeException e) {
            abort(connection, e);
            throw e;
        }

        connection.quit();
        log.debug("Mail from {} delivered to {} via {}", envelope.sender(), envelope.recipients(), envelope.dialAddress());
    }

    private void writeContent(OutputStream data, byte[] content) {
        try {
            data.write(content);
            data.close();
        } catch (InterruptedIOException e) {
            throw new SmtpDeliveryException(SmtpCommand.DATA_END, 704, "704 SMTP DATA " + e, e);
        } catch (IOException e) {
            throw new SmtpDeliveryException(SmtpCommand.DATA_END, 703, "703 SMTP DATA " + e, e);
        }
    }

    private void abort(SmtpConnection connection, RuntimeException cause) {
        log.debug("Aborting SMTP transaction: {}", cause.getMessage());
        try {
            SmtpCommandResponse resetResponse = connection.reset();
            if (resetResponse != null) {
                log.debug("RSET reply: {}", resetResponse.getOriginalMessage());
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }

        try {
            connection.quit();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
