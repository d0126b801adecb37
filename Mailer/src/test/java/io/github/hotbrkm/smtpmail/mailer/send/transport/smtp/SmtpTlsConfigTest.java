package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SmtpTlsConfig behavior verification")
class SmtpTlsConfigTest {

    @Test
    @DisplayName("Configs with the same protocols are equal")
    void equalByProtocolValues() {
        // Given
        SmtpTlsConfig first = new SmtpTlsConfig(List.of("TLSv1.2", "TLSv1.3"), true, "mx.example.com");
        SmtpTlsConfig second = new SmtpTlsConfig(new ArrayList<>(List.of("TLSv1.2", "TLSv1.3")), true, "mx.example.com");

        // When & Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    @DisplayName("Protocols are copied and cannot be changed afterwards")
    void protocolsAreImmutable() {
        // Given
        List<String> protocols = new ArrayList<>(List.of("TLSv1.3"));
        SmtpTlsConfig config = new SmtpTlsConfig(protocols, true, null);

        // When
        protocols.add("TLSv1");

        // Then
        assertThat(config.enabledTlsProtocols()).containsExactly("TLSv1.3");
        assertThatThrownBy(() -> config.enabledTlsProtocols().add("TLSv1"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Missing protocols mean the JDK defaults")
    void nullProtocolsBecomeEmpty() {
        // When
        SmtpTlsConfig config = new SmtpTlsConfig(null, false, " ");

        // Then
        assertThat(config.enabledTlsProtocols()).isEmpty();
        assertThat(config.hasServerName()).isFalse();
    }
}
