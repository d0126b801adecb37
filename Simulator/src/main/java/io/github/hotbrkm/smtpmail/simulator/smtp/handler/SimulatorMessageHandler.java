package io.github.hotbrkm.smtpmail.simulator.smtp.handler;

import io.github.hotbrkm.smtpmail.simulator.smtp.policy.RejectionPolicy;
import io.github.hotbrkm.smtpmail.simulator.smtp.policy.SmtpPhase;
import io.github.hotbrkm.smtpmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.smtpmail.simulator.smtp.service.SmtpMessageStore;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Handles SMTP message processing for the simulator.
 * <p>
 * MAIL FROM, RCPT TO and DATA are checked against the configured rejections. Accepted
 * messages are stored once per accepted recipient.
 * </p>
 */
@Slf4j
public class SimulatorMessageHandler implements MessageHandler {

    private final MessageContext context;
    private final SimulatorSmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final RejectionPolicy rejectionPolicy;
    private final SmtpSessionState sessionState;

    public SimulatorMessageHandler(MessageContext context,
                                   SimulatorSmtpProperties properties,
                                   SmtpMessageStore messageStore,
                                   RejectionPolicy rejectionPolicy) {
        this.context = context;
        this.properties = properties;
        this.messageStore = messageStore;
        this.rejectionPolicy = rejectionPolicy;
        this.sessionState = new SmtpSessionState();
    }

    @Override
    public void from(String from) throws RejectException {
        log.debug("SMTP session started - remote={}, from={}", context.getRemoteAddress(), from);
        reject(SmtpPhase.MAIL_FROM, from);
        sessionState.setFrom(from);
    }

    @Override
    public void recipient(String recipient) throws RejectException {
        log.debug("Processing SMTP recipient - from={}, recipient={}", sessionState.getFrom(), recipient);
        try {
            reject(SmtpPhase.RCPT_TO, recipient);
        } catch (RejectException e) {
            sessionState.recordRejectedRecipient();
            throw e;
        }
        sessionState.addRecipient(recipient);
    }

    @Override
    public String data(InputStream data) throws RejectException {
        log.debug("Processing SMTP DATA - from={}, recipients={}", sessionState.getFrom(), sessionState.getAcceptedRecipientCount());

        try {
            byte[] payload = data.readAllBytes();
            reject(SmtpPhase.DATA, sessionState.getFrom());

            if (!properties.isStoreMessages() || !sessionState.hasAcceptedRecipients()) {
                return "OK";
            }

            for (String recipient : sessionState.getAcceptedRecipients()) {
                try (InputStream payloadStream = new ByteArrayInputStream(payload)) {
                    messageStore.store(sessionState.getFrom(), recipient, payloadStream);
                }
            }
            return "OK";
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error occurred while processing SMTP data.", e);
        }
    }

    @Override
    public void done() {
        log.debug("SMTP session ended - from={}, accepted recipients={}, rejected recipients={}",
                sessionState.getFrom(), sessionState.getAcceptedRecipientCount(), sessionState.getRejectedRecipientCount());
    }

    private void reject(SmtpPhase phase, String address) throws RejectException {
        try {
            rejectionPolicy.check(phase, address);
        } catch (RejectException e) {
            log.info("smtp-reject sessionId={} phase={} code={} msg={} remote={} address={}",
                    context.getSessionId(), phase, e.getCode(), e.getMessage(), context.getRemoteAddress(), address);
            throw e;
        }
    }
}
