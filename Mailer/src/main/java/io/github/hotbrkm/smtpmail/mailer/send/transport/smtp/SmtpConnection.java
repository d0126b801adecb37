package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import java.io.OutputStream;

/**
 * An open SMTP connection that has been greeted and has completed EHLO/HELO.
 * <p>
 * Command methods throw {@link SmtpDeliveryException} when the server rejects the command.
 * {@link #reset()} and {@link #quit()} never throw; they return the server's reply.
 * {@link #quit()} always releases the connection.
 */
public interface SmtpConnection {

    /**
     * Whether the last EHLO reply advertised the extension.
     */
    boolean supportsExtension(String name);

    void startTls(SmtpTlsConfig tlsConfig);

    void mail(String sender);

    void rcpt(String recipient);

    /**
     * Sends DATA and returns the stream for the message content. Closing the stream ends the message.
     */
    OutputStream data();

    SmtpCommandResponse reset();

    SmtpCommandResponse quit();
}
