package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

/**
 * IP literal detection, used to decide whether a TLS server name can be sent as SNI.
 */
public final class IpUtil {

    private IpUtil() {
    }

    /**
     * Determines if the input is an IPv4 literal (e.g., 192.168.0.1).
     * Each octet must be in 0~255 and a trailing dot is not allowed.
     *
     * @param input string to check
     * @return true if IPv4 literal, false otherwise
     */
    public static boolean isIpv4Literal(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if ((c < '0' || c > '9') && c != '.') {
                return false;
            }
        }

        if (input.charAt(input.length() - 1) == '.') {
            return false;
        }

        String[] parts = input.split("\\.");
        if (parts.length != 4) {
            return false;
        }

        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3) {
                return false;
            }
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }

        return true;
    }

    /**
     * Determines if the input looks like an IPv6 literal, with or without brackets.
     * Host names never contain a colon, so the colon check is enough here.
     *
     * @param input string to check
     * @return true if IPv6 literal
     */
    public static boolean isIpv6Literal(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }

        String value = input;
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }

        if (value.indexOf(':') < 0) {
            return false;
        }

        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex && c != ':' && c != '.' && c != '%') {
                return false;
            }
        }

        return true;
    }

    /**
     * Determines if the input is an IPv4 or IPv6 literal.
     *
     * @param input string to check
     * @return true if IP literal
     */
    public static boolean isIpLiteral(String input) {
        return isIpv4Literal(input) || isIpv6Literal(input);
    }
}
