package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import lombok.Getter;

/**
 * Socket options for SMTP connections. A timeout of 0 waits indefinitely.
 */
@Getter
public class SocketConfig {

    private final String bindAddress;
    private final int connectionTimeout;
    private final int readTimeout;

    public SocketConfig(String bindAddress, int connectionTimeout, int readTimeout) {
        this.bindAddress = bindAddress;
        this.connectionTimeout = Math.max(0, connectionTimeout);
        this.readTimeout = Math.max(0, readTimeout);
    }

    public static SocketConfig defaults() {
        return new SocketConfig(null, 0, 0);
    }

    public boolean hasBindAddress() {
        return bindAddress != null && !bindAddress.isBlank();
    }
}
