package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpResponseParser Test")
class SmtpResponseParserTest {

    private final SmtpResponseParser parser = new SmtpResponseParser();

    @Test
    @DisplayName("Single line reply keeps code, message and original line")
    void parseSingleLine() {
        // When
        SmtpResponse response = parser.parseResponse(List.of("250 2.1.0 Sender OK"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(250);
        assertThat(response.getMessage()).isEqualTo("2.1.0 Sender OK");
        assertThat(response.getOriginalMessage()).isEqualTo("250 2.1.0 Sender OK");
        assertThat(response.getExtendedMessages()).isEmpty();
    }

    @Test
    @DisplayName("Multi-line EHLO reply collects extensions and finds keywords")
    void parseEhlo() {
        // Given
        List<String> lines = List.of(
                "250-smtp.example.com Hello",
                "250-SIZE 10240000",
                "250-STARTTLS",
                "250 8BITMIME");

        // When
        SmtpResponse response = parser.parseResponse(lines);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(250);
        assertThat(response.getExtendedMessages()).containsExactly("smtp.example.com Hello", "SIZE 10240000", "STARTTLS");
        assertThat(response.hasKeyword("STARTTLS")).isTrue();
        assertThat(response.hasKeyword("starttls")).isTrue();
        assertThat(response.hasKeyword("SIZE")).isTrue();
        assertThat(response.hasKeyword("8BITMIME")).isTrue();
        assertThat(response.hasKeyword("AUTH")).isFalse();
    }

    @Test
    @DisplayName("Reply without a three digit code becomes 888")
    void parseMalformed() {
        // When
        SmtpResponse response = parser.parseResponse(List.of("hello there"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(SmtpResponseParser.INVALID_RESPONSE);
        assertThat(response.getOriginalMessage()).startsWith("888 ").contains("hello there");
    }

    @Test
    @DisplayName("Empty reply becomes 888")
    void parseEmpty() {
        // When
        SmtpResponse response = parser.parseResponse(List.of());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(888);
    }

    @Test
    @DisplayName("Bare three digit code is accepted")
    void parseCodeOnly() {
        // When
        SmtpResponse response = parser.parseResponse(List.of("221"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(221);
        assertThat(response.getMessage()).isEmpty();
    }

    @Test
    @DisplayName("Command response is successful only for the command's expected code")
    void commandResponseSuccess() {
        // When
        SmtpCommandResponse dataResponse = new SmtpCommandResponse(SmtpCommand.DATA, List.of("354 End data with <CR><LF>.<CR><LF>"));
        SmtpCommandResponse rcptResponse = new SmtpCommandResponse(SmtpCommand.RCPT_TO, List.of("354 unexpected"));

        // Then
        assertThat(dataResponse.isSuccess()).isTrue();
        assertThat(rcptResponse.isSuccess()).isFalse();
    }
}
