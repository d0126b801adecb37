package io.github.hotbrkm.smtpmail.simulator.smtp.policy;

/**
 * SMTP commands at which the simulator can reject.
 */
public enum SmtpPhase {
    /** MAIL FROM, matched against the sender. */
    MAIL_FROM,
    /** RCPT TO, matched against the recipient. */
    RCPT_TO,
    /** End of DATA, matched against the sender. */
    DATA
}
