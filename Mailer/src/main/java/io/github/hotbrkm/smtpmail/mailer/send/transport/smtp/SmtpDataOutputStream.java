package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Message content stream opened by DATA.
 * <p>
 * Lines starting with '.' are dot-stuffed and bare LF is written as CRLF. {@link #close()} writes the
 * {@code CRLF.CRLF} terminator, reads the server's reply and fails with {@link SmtpDeliveryException}
 * unless it is 250. Closing does not close the connection.
 */
public class SmtpDataOutputStream extends OutputStream {

    private static final int BEGIN_LINE = 0;
    private static final int IN_LINE = 1;
    private static final int AFTER_CR = 2;

    private final OutputStream out;
    private final SmtpCommandHandler commandHandler;
    private int state = BEGIN_LINE;
    private boolean closed;

    public SmtpDataOutputStream(OutputStream out, SmtpCommandHandler commandHandler) {
        this.out = out;
        this.commandHandler = commandHandler;
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();

        switch (state) {
            case BEGIN_LINE -> {
                if (b == '.') {
                    out.write('.');
                }
                writeInLine(b);
            }
            case AFTER_CR -> {
                state = b == '\n' ? BEGIN_LINE : IN_LINE;
                if (state == IN_LINE) {
                    writeInLine(b);
                } else {
                    out.write(b);
                }
            }
            default -> writeInLine(b);
        }
    }

    private void writeInLine(int b) throws IOException {
        state = IN_LINE;
        if (b == '\r') {
            state = AFTER_CR;
        } else if (b == '\n') {
            out.write('\r');
            state = BEGIN_LINE;
        }
        out.write(b);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        switch (state) {
            case IN_LINE -> out.write(new byte[]{'\r', '\n', '.', '\r', '\n'});
            case AFTER_CR -> out.write(new byte[]{'\n', '.', '\r', '\n'});
            default -> out.write(new byte[]{'.', '\r', '\n'});
        }
        out.flush();

        SmtpCommandResponse response = commandHandler.readDataEndResponse();
        if (!response.isSuccess()) {
            throw new SmtpDeliveryException(response);
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("SMTP data stream is closed");
        }
    }
}
