package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import lombok.Getter;

/**
 * SMTP server host and port to dial.
 */
@Getter
public class ServerAddress {

    private static final String COLON = ":";

    private final String host;
    private final int port;

    public ServerAddress(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("SMTP server host is empty");
        }
        this.host = cleanHost(host.trim());
        this.port = port;
    }

    /**
     * Parses a {@code host:port} dial address. IPv6 literals must be bracketed ({@code [::1]:25}).
     *
     * @param address dial address
     * @return parsed server address
     */
    public static ServerAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("SMTP server address is empty");
        }

        int colon = address.lastIndexOf(COLON);
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("SMTP server address must be host:port (" + address + ")");
        }

        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        try {
            return new ServerAddress(host, Integer.parseInt(address.substring(colon + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("SMTP server port is not a number (" + address + ")", e);
        }
    }

    /**
     * Builds the dial address for a configured server value.
     * A server that already contains a colon is used verbatim.
     */
    public static String toDialAddress(String server, int port) {
        if (server.contains(COLON)) {
            return server;
        }
        return server + COLON + port;
    }

    private String cleanHost(String host) {
        if (host.endsWith(".")) {
            return host.substring(0, host.length() - 1);
        }
        return host;
    }

    @Override
    public String toString() {
        if (host.contains(COLON)) {
            return "[" + host + "]" + COLON + port;
        }
        return host + COLON + port;
    }
}
