package io.github.hotbrkm.smtpmail.mailer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "mailer")
public class MailerConfig {

    private boolean enabled = true;

    private Smtp smtp = new Smtp();
    private Tls tls = new Tls();

    @Data
    public static class Smtp {
        public static final int DEFAULT_PORT = 25;
        public static final String DEFAULT_HELO = "localhost";

        private String server;
        private int port = DEFAULT_PORT;
        private boolean useTls;
        private String helo = DEFAULT_HELO;
        private String bindAddress;

        // milliseconds, 0 waits indefinitely
        private int connectionTimeout;
        private int readTimeout;

        private boolean trace;
    }

    @Data
    public static class Tls {
        private List<String> enabledProtocols = new ArrayList<>();
        private boolean trustAllCertificates = true;

        public String[] resolveEnabledProtocols() {
            if (enabledProtocols == null) {
                return new String[0];
            }
            return enabledProtocols.stream()
                    .filter(protocol -> protocol != null && !protocol.isBlank())
                    .map(String::trim)
                    .toArray(String[]::new);
        }
    }
}
