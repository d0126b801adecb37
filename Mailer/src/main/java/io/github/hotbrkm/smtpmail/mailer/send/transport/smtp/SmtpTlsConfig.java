package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import java.util.List;

/**
 * STARTTLS settings for one connection.
 *
 * @param enabledTlsProtocols  protocols to enable, empty for the JDK defaults
 * @param trustAllCertificates skip server certificate verification
 * @param serverName           TLS server name (SNI), may be null
 */
public record SmtpTlsConfig(List<String> enabledTlsProtocols, boolean trustAllCertificates, String serverName) {

    public SmtpTlsConfig {
        enabledTlsProtocols = enabledTlsProtocols == null ? List.of() : List.copyOf(enabledTlsProtocols);
    }

    public boolean hasServerName() {
        return serverName != null && !serverName.isBlank();
    }
}
