package io.github.hotbrkm.smtpmail.mailer.send.transport.smtp;

import java.util.List;

class SmtpResponseParser {

    static final int INVALID_RESPONSE = 888;

    public SmtpResponse parseResponse(List<String> lines) {
        SmtpResponse smtpResponse = new SmtpResponse();

        for (String line : lines) {
            // A malformed line only counts when no status code has been read yet
            if (!hasStatusCode(line)) {
                if (smtpResponse.getStatusCode() <= 0) {
                    setInvalidResponseMessage(line, smtpResponse);
                }
                continue;
            }

            int statusCode = Integer.parseInt(line.substring(0, 3));
            String message = line.length() > 4 ? line.substring(4).trim() : "";

            if (isMultiLineResponse(line)) {
                smtpResponse.addExtendedMessage(message);
            } else {
                smtpResponse.setStatusCode(statusCode);
                smtpResponse.setMessage(message);
                smtpResponse.setOriginalMessage(line);
            }
        }

        if (smtpResponse.getStatusCode() <= 0) {
            setInvalidResponseMessage(null, smtpResponse);
        }

        return smtpResponse;
    }

    private boolean hasStatusCode(String line) {
        if (line == null || line.length() < 3) {
            return false;
        }
        for (int i = 0; i < 3; i++) {
            if (!Character.isDigit(line.charAt(i))) {
                return false;
            }
        }
        return line.length() == 3 || line.charAt(3) == ' ' || line.charAt(3) == '-';
    }

    private void setInvalidResponseMessage(String line, SmtpResponse smtpResponse) {
        smtpResponse.setStatusCode(INVALID_RESPONSE);
        smtpResponse.setMessage("response message is invalid. [" + line + "]");
        smtpResponse.setOriginalMessage(INVALID_RESPONSE + " response message is invalid. [" + line + "]");
    }

    private boolean isMultiLineResponse(String line) {
        return line.length() > 3 && line.charAt(3) == '-';
    }
}
