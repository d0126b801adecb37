package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpTlsConfig;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;

/**
 * Layers TLS over an already connected SMTP socket (STARTTLS).
 */
@Slf4j
public class SslSocketConverter {

    private final SmtpTlsConfig tlsConfig;

    public SslSocketConverter(SmtpTlsConfig tlsConfig) {
        this.tlsConfig = tlsConfig;
    }

    public SSLSocket upgradeToSslSocket(Socket socket) throws IOException {
        SSLSocket sslSocket = createSslSocket(socket);
        try {
            sslSocket.startHandshake();
            return sslSocket;
        } catch (IOException e) {
            sslSocket.close();
            throw e;
        }
    }

    private SSLSocket createSslSocket(Socket socket) throws IOException {
        String peerHost = tlsConfig.hasServerName() ? tlsConfig.serverName() : socket.getInetAddress().getHostAddress();
        SSLSocket sslSocket = (SSLSocket) socketFactory().createSocket(socket, peerHost, socket.getPort(), true);
        sslSocket.setUseClientMode(true);

        List<String> tlsVersions = tlsConfig.enabledTlsProtocols();
        if (!tlsVersions.isEmpty()) {
            sslSocket.setEnabledProtocols(tlsVersions.toArray(new String[0]));
        }

        sniHostName().ifPresent(hostName -> {
            SSLParameters parameters = sslSocket.getSSLParameters();
            parameters.setServerNames(List.of(hostName));
            sslSocket.setSSLParameters(parameters);
        });

        return sslSocket;
    }

    /**
     * SNI carries LDH host names only. IP literals and names such as {@code mail_relay.internal}
     * are sent without a server name indication.
     */
    Optional<SNIServerName> sniHostName() {
        if (!tlsConfig.hasServerName() || IpUtil.isIpLiteral(tlsConfig.serverName())) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SNIHostName(tlsConfig.serverName()));
        } catch (IllegalArgumentException e) {
            log.debug("Server name {} is not a valid SNI host name, skipping SNI: {}", tlsConfig.serverName(), e.getMessage());
            return Optional.empty();
        }
    }

    private SSLSocketFactory socketFactory() throws IOException {
        if (!tlsConfig.trustAllCertificates()) {
            return (SSLSocketFactory) SSLSocketFactory.getDefault();
        }

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{new TrustAllTrustManager()}, new SecureRandom());
            return sslContext.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to initialize TLS context", e);
        }
    }

    /**
     * Accepts any server certificate. Server identity is not verified.
     */
    private static final class TrustAllTrustManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // client certificates are not used
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // verification disabled
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
