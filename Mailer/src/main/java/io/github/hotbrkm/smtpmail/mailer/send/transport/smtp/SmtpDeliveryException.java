package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import lombok.Getter;

/**
 * Raised when an SMTP step fails. Keeps the failing command and the server's reply as received.
 */
@Getter
public class SmtpDeliveryException extends RuntimeException {
    private final SmtpCommand command;
    private final int statusCode;
    private final String originalMessage;

    public SmtpDeliveryException(SmtpCommandResponse response) {
        this(response.getCommand(), response.getStatusCode(), response.getOriginalMessage(), null);
    }

    public SmtpDeliveryException(SmtpCommand command, int statusCode, String originalMessage, Throwable cause) {
        super(originalMessage, cause);
        this.command = command;
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
    }

    /**
     * Whether the server answered with a 4xx (transient) reply.
     */
    public boolean isTransient() {
        return statusCode >= 400 && statusCode < 500;
    }
}
