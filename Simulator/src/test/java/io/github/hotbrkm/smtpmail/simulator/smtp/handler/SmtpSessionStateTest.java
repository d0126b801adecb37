package io.github.hotbrkm.smtpmail.simulator.smtp.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpSessionState Test")
class SmtpSessionStateTest {

    private SmtpSessionState sessionState;

    @BeforeEach
    void setUp() {
        sessionState = new SmtpSessionState();
    }

    @Test
    @DisplayName("Can set and retrieve sender address")
    void setAndGetFrom() {
        // Given
        String from = "sender@example.com";

        // When
        sessionState.setFrom(from);

        // Then
        assertThat(sessionState.getFrom()).isEqualTo(from);
    }

    @Test
    @DisplayName("Can add recipients and retrieve list in order")
    void addAndGetRecipients() {
        // When
        sessionState.addRecipient("user1@example.com");
        sessionState.addRecipient("user2@example.com");

        // Then
        assertThat(sessionState.getAcceptedRecipients())
                .containsExactly("user1@example.com", "user2@example.com");
        assertThat(sessionState.getAcceptedRecipientCount()).isEqualTo(2);
        assertThat(sessionState.hasAcceptedRecipients()).isTrue();
    }

    @Test
    @DisplayName("Returns false for hasAcceptedRecipients when no recipients")
    void hasAcceptedRecipients_empty_returnsFalse() {
        assertThat(sessionState.hasAcceptedRecipients()).isFalse();
    }

    @Test
    @DisplayName("Rejected recipients are counted but not accepted")
    void recordRejectedRecipient() {
        // When
        sessionState.recordRejectedRecipient();
        sessionState.recordRejectedRecipient();

        // Then
        assertThat(sessionState.getRejectedRecipientCount()).isEqualTo(2);
        assertThat(sessionState.getAcceptedRecipientCount()).isZero();
    }

    @Test
    @DisplayName("Recipient list is immutable")
    void getAcceptedRecipients_returnsImmutableList() {
        // Given
        sessionState.addRecipient("user@example.com");

        // When & Then
        assertThat(sessionState.getAcceptedRecipients())
                .isUnmodifiable();
    }
}
