package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

/**
 * Opens SMTP connections.
 */
public interface SmtpConnector {

    /**
     * Connects to {@code host:port}, reads the greeting and says hello.
     * On failure nothing stays open.
     *
     * @param address dial address in {@code host:port} form
     * @return a ready connection
     * @throws SmtpDeliveryException if the connection or the greeting fails
     */
    SmtpConnection dial(String address);
}
