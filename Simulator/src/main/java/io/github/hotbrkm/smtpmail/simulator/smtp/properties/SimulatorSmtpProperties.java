package io.github.hotbrkm.smtpmail.simulator.smtp.properties;

import io.github.hotbrkm.smtpmail.simulator.smtp.policy.SmtpPhase;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SMTP simulator server.
 * <p>
 * These properties are loaded from the {@code simulator.smtp} prefix in application.yml.
 * </p>
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * simulator:
 *   smtp:
 *     port: 2525
 *     inbox-directory: ./inbox
 *     rejections:
 *       - phase: rcpt-to
 *         match: "@blocked.example"
 *         code: 550
 *         message: "5.1.1 Mailbox unavailable"
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "simulator.smtp")
public class SimulatorSmtpProperties {

    /**
     * Whether the SMTP server is enabled.
     */
    private boolean enabled = true;

    /**
     * Port number for the SMTP server to listen on.
     */
    private int port = 2525;

    /**
     * Host name announced in the greeting.
     */
    private String hostName;

    /**
     * Address to bind the SMTP server to.
     */
    private String bindAddress;

    /**
     * Maximum number of concurrent connections allowed.
     */
    private Integer maxConnections;

    /**
     * Maximum message size in bytes.
     */
    private Integer maxMessageSize;

    /**
     * Directory path for storing received messages.
     */
    private String inboxDirectory;

    /**
     * Whether to store received messages to disk.
     */
    private boolean storeMessages = true;

    /**
     * Rejections applied in configuration order; the first match wins.
     */
    private List<Rejection> rejections = new ArrayList<>();

    @Getter
    @Setter
    public static class Rejection {
        /** Phase the rejection applies to. */
        private SmtpPhase phase = SmtpPhase.RCPT_TO;
        /** Address ({@code user@example.com}) or domain ({@code @example.com}); empty matches everything. */
        private String match;
        /** SMTP reply code. */
        private int code = 550;
        /** SMTP reply text. */
        private String message = "Requested action not taken";
    }
}
