package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpCommand.*;

/**
 * Sends SMTP commands over a {@link SmtpSession} and keeps the reply history.
 * I/O failures are turned into synthetic reply lines so callers only deal with replies.
 */
@Slf4j
public class SmtpCommandHandler {
    static final int IO_ERROR = 703;
    static final int INTERRUPTED_IO_ERROR = 704;

    private final SmtpSession session;
    private final List<SmtpCommandResponse> responses = new ArrayList<>();

    @Setter
    @Getter
    private boolean traceLog = false;

    public SmtpCommandHandler(SmtpSession session) {
        this.session = session;
    }

    public SmtpCommandResponse readInitResponse() {
        return record(INIT, sendCommand(null));
    }

    public List<String> sendCommand(String command) {
        List<String> responseLines = new ArrayList<>();

        try {
            writeMessage(command);
            readAllMessages(responseLines);
        } catch (InterruptedIOException e) {
            responseLines.add(INTERRUPTED_IO_ERROR + " SMTP " + e);
        } catch (IOException e) {
            responseLines.add(IO_ERROR + " SMTP " + e);
        }
        return responseLines;
    }

    private void writeMessage(String command) throws IOException {
        if (command != null) {
            if (traceLog) {
                log.info("[Send Message]: {}", command);
            }
            session.writeMessage(command);
        }
    }

    private void readAllMessages(List<String> responseLines) throws IOException {
        String line;
        do {
            line = session.readLine();
            if (traceLog) {
                log.info("[Read Message]: {}", line);
            }

            if (line == null) {
                throw new IOException("null reply from server");
            }

            responseLines.add(line);
        } while ((line.length() > 3) && (line.charAt(3) == '-'));
    }

    public SmtpCommandResponse sendEhloOrHelo(String helo) {
        SmtpCommandResponse smtpCommandResponse = sendEhlo(helo);

        if (smtpCommandResponse.isSuccess()) {
            return smtpCommandResponse;
        } else {
            return sendHelo(helo);
        }
    }

    public SmtpCommandResponse sendEhlo(String helo) {
        return record(EHLO, sendCommand(EHLO.buildMessage(helo)));
    }

    public SmtpCommandResponse sendHelo(String helo) {
        return record(HELO, sendCommand(HELO.buildMessage(helo)));
    }

    public SmtpCommandResponse sendStartTls() {
        return record(STARTTLS, sendCommand(STARTTLS.getCommand()));
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom) {
        return record(MAIL_FROM, sendCommand(MAIL_FROM.buildMessage("<" + mailFrom + ">")));
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo) {
        return record(RCPT_TO, sendCommand(RCPT_TO.buildMessage("<" + rcptTo + ">")));
    }

    public SmtpCommandResponse sendData() {
        return record(DATA, sendCommand(DATA.getCommand()));
    }

    /**
     * Reads the reply to the end-of-data terminator, which the data stream has already written.
     * Expects 250.
     */
    public SmtpCommandResponse readDataEndResponse() {
        if (traceLog) {
            log.info("[Send Message]: .");
        }
        return record(DATA_END, sendCommand(null));
    }

    public SmtpCommandResponse sendRset() {
        return record(RSET, sendCommand(RSET.getCommand()));
    }

    public SmtpCommandResponse sendQuit() {
        return record(QUIT, sendCommand(QUIT.getCommand()));
    }

    private SmtpCommandResponse record(SmtpCommand command, List<String> responseLines) {
        SmtpCommandResponse smtpCommandResponse = new SmtpCommandResponse(command, responseLines);
        addSmtpCommandResponse(smtpCommandResponse);
        return smtpCommandResponse;
    }

    // ========== Response history ==========

    public void addSmtpCommandResponse(SmtpCommandResponse response) {
        this.responses.add(response);
    }

    /**
     * Creates a response from SMTP command and message, then adds to history.
     */
    public SmtpCommandResponse addResponse(SmtpCommand smtpCommand, String message) {
        return record(smtpCommand, Collections.singletonList(message));
    }

    public List<SmtpCommandResponse> getResponses() {
        return Collections.unmodifiableList(responses);
    }
}
