package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Getter
@Setter
class SmtpResponse {

    private final List<String> extendedMessages = new ArrayList<>();
    private int statusCode;
    private String message;
    private String originalMessage;

    public void addExtendedMessage(String extendedMessage) {
        this.extendedMessages.add(extendedMessage);
    }

    /**
     * Checks whether any reply line starts with the given keyword, e.g. an EHLO extension
     * such as {@code STARTTLS} or {@code SIZE 10240000}.
     */
    public boolean hasKeyword(String keyword) {
        String expected = keyword.toUpperCase(Locale.ROOT);
        for (String line : extendedMessages) {
            if (firstToken(line).equals(expected)) {
                return true;
            }
        }
        return message != null && firstToken(message).equals(expected);
    }

    private static String firstToken(String line) {
        String trimmed = line.trim();
        int space = trimmed.indexOf(' ');
        String token = space < 0 ? trimmed : trimmed.substring(0, space);
        return token.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        StringBuilder responseBuilder = new StringBuilder();

        for (String extMessage : extendedMessages) {
            responseBuilder.append(statusCode).append("-").append(extMessage).append("\n");
        }

        responseBuilder.append(statusCode).append(" ").append(message);
        return responseBuilder.toString();
    }
}
