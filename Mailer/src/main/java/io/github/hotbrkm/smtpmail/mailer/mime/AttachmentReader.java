package io.github.hotbrkm.smtpmail.mailer.mime;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

class AttachmentReader {

    /**
     * Reads an attachment file fully into memory.
     *
     * @param filePath local file path
     * @return file content
     * @throws IOException if no path is given or the file cannot be read
     */
    public byte[] read(String filePath) throws IOException {
        if (filePath == null || filePath.isEmpty()) {
            throw new FileNotFoundException("No attachment specified");
        }
        return Files.readAllBytes(Path.of(filePath));
    }

    /**
     * Returns the last name element of the path, which becomes the attachment name.
     */
    public String fileName(String filePath) {
        Path name = Path.of(filePath).getFileName();
        return name == null ? filePath : name.toString();
    }
}
