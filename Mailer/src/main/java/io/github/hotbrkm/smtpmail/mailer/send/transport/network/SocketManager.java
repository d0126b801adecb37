package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpTlsConfig;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

@Slf4j
public class SocketManager {

    private final SocketConfig config;

    public SocketManager(SocketConfig config) {
        this.config = config;
    }

    public Socket createSocket(ServerAddress serverAddress) throws IOException {
        Socket socket = new Socket();
        try {
            if (config.hasBindAddress()) {
                socket.bind(new InetSocketAddress(config.getBindAddress(), 0));
            }
            socket.connect(new InetSocketAddress(serverAddress.getHost(), serverAddress.getPort()), config.getConnectionTimeout());
            socket.setSoTimeout(config.getReadTimeout());
            return socket;
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    public SSLSocket upgradeToSslSocket(Socket socket, SmtpTlsConfig tlsConfig) throws IOException {
        SslSocketConverter sslSocketConverter = new SslSocketConverter(tlsConfig);
        return sslSocketConverter.upgradeToSslSocket(socket);
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Failed to close socket", e);
        }
    }
}
