package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Server-side TLS for tests, backed by the self-signed {@code tls/simulator-keystore.p12}
 * (CN=smtp.simulator). Clients must trust all certificates to connect.
 */
public final class TestKeyStores {

    private static final String KEYSTORE_RESOURCE = "/tls/simulator-keystore.p12";
    private static final char[] KEYSTORE_PASSWORD = "changeit".toCharArray();

    private TestKeyStores() {
    }

    public static SSLContext serverSslContext() {
        try (InputStream in = TestKeyStores.class.getResourceAsStream(KEYSTORE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing test keystore " + KEYSTORE_RESOURCE);
            }
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(in, KEYSTORE_PASSWORD);

            KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagerFactory.init(keyStore, KEYSTORE_PASSWORD);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagerFactory.getKeyManagers(), null, null);
            return sslContext;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to load test keystore", e);
        }
    }
}
