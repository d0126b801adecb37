package io.github.hotbrkm.smtpmail.mailer.mime;

import lombok.experimental.UtilityClass;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Random base-36 tokens for MIME boundaries. Only needs to avoid accidental clashes with content.
 */
@UtilityClass
public class BoundaryGenerator {

    public static String next() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return Long.toString(random.nextLong() & Long.MAX_VALUE, 36)
                + Long.toString(random.nextLong() & Long.MAX_VALUE, 36);
    }
}
