package io.github.hotbrkm.smtpmail.simulator.smtp.handler;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Manages the SMTP session state.
 * <p>
 * Encapsulates the envelope collected by one message handler.
 */
public class SmtpSessionState {

    private final List<String> acceptedRecipients = new ArrayList<>();

    @Getter
    @Setter
    private String from;

    @Getter
    private int rejectedRecipientCount;

    /**
     * Adds a recipient to the list of accepted recipients.
     *
     * @param recipient Recipient email address
     */
    public void addRecipient(String recipient) {
        acceptedRecipients.add(recipient);
    }

    public void recordRejectedRecipient() {
        rejectedRecipientCount++;
    }

    /**
     * Returns the accepted recipient list (immutable).
     *
     * @return Recipient list
     */
    public List<String> getAcceptedRecipients() {
        return Collections.unmodifiableList(acceptedRecipients);
    }

    public int getAcceptedRecipientCount() {
        return acceptedRecipients.size();
    }

    public boolean hasAcceptedRecipients() {
        return !acceptedRecipients.isEmpty();
    }
}
