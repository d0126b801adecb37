package io.github.hotbrkm.smtpmail.mailer.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BoundaryGenerator Test")
class BoundaryGeneratorTest {

    @Test
    @DisplayName("Boundaries are non-empty base-36 tokens and do not repeat")
    void generate() {
        // Given
        Set<String> boundaries = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            boundaries.add(BoundaryGenerator.next());
        }

        // Then
        assertThat(boundaries).hasSize(1000);
        assertThat(boundaries).allSatisfy(boundary -> assertThat(boundary).matches("[0-9a-z]+"));
    }
}
