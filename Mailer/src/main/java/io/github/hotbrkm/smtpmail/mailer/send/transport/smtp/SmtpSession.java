package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Network side of one SMTP connection: the socket, its TLS layer once STARTTLS succeeded,
 * and the line reader / byte writer over whichever is current.
 */
@Getter
@Slf4j
public class SmtpSession implements AutoCloseable {

    private static final byte[] CRLF = {'\r', '\n'};

    private Socket socket;
    private SSLSocket sslSocket;
    private BufferedReader reader;
    private OutputStream output;

    public void writeMessage(String message) throws IOException {
        if (output == null) {
            throw new IOException("SMTP session is not connected");
        }

        output.write(message.getBytes(StandardCharsets.UTF_8));
        output.write(CRLF);
        output.flush();
    }

    public String readLine() throws IOException {
        if (reader == null) {
            throw new IOException("SMTP session is not connected");
        }

        return reader.readLine();
    }

    public void changeSocket(Socket socket) throws IOException {
        close();
        this.socket = socket;
        this.sslSocket = null;
        changeStream(socket);
    }

    public void setSslSocket(SSLSocket sslSocket) throws IOException {
        this.sslSocket = sslSocket;
        changeStream(sslSocket);
    }

    public boolean isTlsActive() {
        return sslSocket != null;
    }

    private void changeStream(Socket socket) throws IOException {
        this.output = new BufferedOutputStream(socket.getOutputStream());
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        closeQuietly(output);
        closeQuietly(reader);
        closeQuietly(sslSocket);
        closeQuietly(socket);
        output = null;
        reader = null;
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Failed to close SMTP session resource", e);
            }
        }
    }
}
