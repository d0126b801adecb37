package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import io.github.hotbrkm.smtpmail.mailer.send.transport.network.ServerAddress;
import io.github.hotbrkm.smtpmail.mailer.send.transport.network.SocketConfig;
import io.github.hotbrkm.smtpmail.mailer.send.transport.network.SocketManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.OutputStream;
import java.net.NoRouteToHostException;

import static io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommand.CONNECT;
import static io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommand.EHLO;
import static io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommand.STARTTLS;

/**
 * Socket based SMTP client for a single connection.
 */
@Slf4j
public class SmtpClient implements SmtpConnection {

    static final int NO_ROUTE_TO_HOST = 601;
    static final int CONNECT_FAILED = 602;

    private final SocketManager socketManager;
    private final SmtpCommandHandler smtpCommandHandler;

    @Getter
    private final SmtpSession sessionInfo;

    @Getter
    private final String helo;

    @Getter
    private ServerAddress serverAddress;

    private SmtpCommandResponse helloResponse;

    public SmtpClient(SocketConfig socketConfig, String helo) {
        this(socketConfig, helo, false);
    }

    public SmtpClient(SocketConfig socketConfig, String helo, boolean traceLog) {
        this.sessionInfo = new SmtpSession();
        this.socketManager = new SocketManager(socketConfig);
        this.smtpCommandHandler = new SmtpCommandHandler(sessionInfo);
        this.smtpCommandHandler.setTraceLog(traceLog);
        this.helo = helo;
    }

    /**
     * Opens the socket, reads the 220 greeting and sends EHLO (HELO when EHLO is refused).
     *
     * @param serverAddress server to connect to
     * @throws SmtpDeliveryException if any of those steps fails
     */
    public void connect(ServerAddress serverAddress) {
        this.serverAddress = serverAddress;

        try {
            sessionInfo.changeSocket(socketManager.createSocket(serverAddress));
        } catch (NoRouteToHostException e) {
            throw connectFailure(NO_ROUTE_TO_HOST, e);
        } catch (IOException e) {
            throw connectFailure(CONNECT_FAILED, e);
        }
        smtpCommandHandler.addResponse(CONNECT, "250 Connection OK");

        SmtpCommandResponse initResponse = smtpCommandHandler.readInitResponse();
        if (!initResponse.isSuccess()) {
            throw new SmtpDeliveryException(initResponse);
        }

        hello();
    }

    private SmtpDeliveryException connectFailure(int statusCode, IOException e) {
        SmtpCommandResponse response = smtpCommandHandler.addResponse(CONNECT,
                statusCode + " connect to " + serverAddress + " " + e);
        return new SmtpDeliveryException(CONNECT, response.getStatusCode(), response.getOriginalMessage(), e);
    }

    private void hello() {
        SmtpCommandResponse response = smtpCommandHandler.sendEhloOrHelo(helo);
        if (!response.isSuccess()) {
            throw new SmtpDeliveryException(response);
        }
        helloResponse = response;
    }

    @Override
    public boolean supportsExtension(String name) {
        return helloResponse != null
                && helloResponse.getCommand() == EHLO
                && helloResponse.hasKeyword(name);
    }

    /**
     * Executes STARTTLS, layers TLS over the socket and repeats EHLO on the encrypted channel.
     * There is no fallback to plaintext: a refused command or failed handshake is thrown.
     */
    @Override
    public void startTls(SmtpTlsConfig tlsConfig) {
        SmtpCommandResponse tlsResponse = smtpCommandHandler.sendStartTls();
        if (!tlsResponse.isSuccess()) {
            throw new SmtpDeliveryException(tlsResponse);
        }

        try {
            SSLSocket sslSocket = socketManager.upgradeToSslSocket(sessionInfo.getSocket(), tlsConfig);
            sessionInfo.setSslSocket(sslSocket);
        } catch (IOException e) {
            SmtpCommandResponse response = smtpCommandHandler.addResponse(STARTTLS,
                    SmtpCommandHandler.IO_ERROR + " TLS handshake with " + serverAddress + " failed " + e);
            throw new SmtpDeliveryException(STARTTLS, response.getStatusCode(), response.getOriginalMessage(), e);
        }

        log.debug("TLS established with {}", serverAddress);
        hello();
    }

    @Override
    public void mail(String sender) {
        SmtpCommandResponse response = smtpCommandHandler.sendMailFrom(sender);
        if (!response.isSuccess()) {
            throw new SmtpDeliveryException(response);
        }
    }

    @Override
    public void rcpt(String recipient) {
        SmtpCommandResponse response = smtpCommandHandler.sendRcptTo(recipient);
        if (!response.isSuccess()) {
            throw new SmtpDeliveryException(response);
        }
    }

    @Override
    public OutputStream data() {
        SmtpCommandResponse response = smtpCommandHandler.sendData();
        if (!response.isSuccess()) {
            throw new SmtpDeliveryException(response);
        }
        return new SmtpDataOutputStream(sessionInfo.getOutput(), smtpCommandHandler);
    }

    @Override
    public SmtpCommandResponse reset() {
        return smtpCommandHandler.sendRset();
    }

    @Override
    public SmtpCommandResponse quit() {
        try {
            SmtpCommandResponse response = smtpCommandHandler.sendQuit();
            if (!response.isSuccess()) {
                log.debug("QUIT was not acknowledged by {}: {}", serverAddress, response.getOriginalMessage());
            }
            return response;
        } finally {
            closeSession();
        }
    }

    public boolean isTlsActive() {
        return sessionInfo.isTlsActive();
    }

    public SmtpCommandHandler getCommandHandler() {
        return smtpCommandHandler;
    }

    public void closeSession() {
        sessionInfo.close();
    }
}
