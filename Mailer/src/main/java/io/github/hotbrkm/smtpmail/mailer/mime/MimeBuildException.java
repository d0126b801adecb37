package io.github.hotbrkm.smtpmail.mailer.mime;

/**
 * The message cannot be serialized.
 */
public class MimeBuildException extends RuntimeException {

    public MimeBuildException(String message) {
        super(message);
    }

    public MimeBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
