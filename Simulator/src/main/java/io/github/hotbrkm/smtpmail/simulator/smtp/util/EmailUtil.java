package io.github.hotbrkm.smtpmail.simulator.smtp.util;

import java.util.Locale;

/**
 * Utility class for email address operations.
 */
public final class EmailUtil {

    private EmailUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the domain part from an email address.
     *
     * @param address Email address (e.g. user@example.com)
     * @return Domain part (lowercase), or null if invalid
     */
    public static String extractDomain(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        int at = trimmed.lastIndexOf('@');
        if (at < 0 || at == trimmed.length() - 1) {
            return null;
        }
        return trimmed.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Replaces characters that are unsafe in file names.
     *
     * @return sanitized address, or {@code unknown} for null
     */
    public static String toFileNamePart(String address) {
        if (address == null || address.isBlank()) {
            return "unknown";
        }
        return address.replaceAll("[^a-zA-Z0-9@._-]", "_");
    }
}
