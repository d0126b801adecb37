package io.github.hotbrkm.smtpmail.mailer.config;

import io.github.hotbrkm.smtpmail.mailer.mime.MailMessage;
import io.github.hotbrkm.smtpmail.mailer.send.MailDelivery;
import io.github.hotbrkm.smtpmail.mailer.send.MailMessageFactory;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpConnector;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SocketSmtpConnector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("MailerAutoConfig Test")
class MailerAutoConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MailerAutoConfig.class));

    @Test
    @DisplayName("Beans are created with default properties")
    void defaults() {
        contextRunner
                .withPropertyValues("mailer.smtp.server=smtp.example.com")
                .run(context -> {
                    assertThat(context).hasSingleBean(SmtpConnector.class);
                    assertThat(context).hasSingleBean(MailDelivery.class);
                    assertThat(context).hasSingleBean(MailMessageFactory.class);

                    SocketSmtpConnector connector = context.getBean(SocketSmtpConnector.class);
                    assertThat(connector.getHelo()).isEqualTo("localhost");
                    assertThat(connector.isTraceLog()).isFalse();
                    assertThat(connector.getSocketConfig().getConnectionTimeout()).isZero();
                    assertThat(connector.getSocketConfig().hasBindAddress()).isFalse();

                    MailMessageFactory factory = context.getBean(MailMessageFactory.class);
                    assertThat(factory.getServer()).isEqualTo("smtp.example.com");
                    assertThat(factory.getPort()).isEqualTo(25);
                    assertThat(factory.isUseTls()).isFalse();
                });
    }

    @Test
    @DisplayName("SMTP and TLS properties are bound")
    void customProperties() {
        contextRunner
                .withPropertyValues(
                        "mailer.smtp.server=smtp.example.com",
                        "mailer.smtp.port=587",
                        "mailer.smtp.use-tls=true",
                        "mailer.smtp.helo=mailer.example.com",
                        "mailer.smtp.bind-address=10.0.0.5",
                        "mailer.smtp.connection-timeout=5000",
                        "mailer.smtp.read-timeout=30000",
                        "mailer.smtp.trace=true",
                        "mailer.tls.enabled-protocols=TLSv1.2,TLSv1.3",
                        "mailer.tls.trust-all-certificates=false")
                .run(context -> {
                    MailerConfig config = context.getBean(MailerConfig.class);
                    assertThat(config.getTls().resolveEnabledProtocols()).containsExactly("TLSv1.2", "TLSv1.3");
                    assertThat(config.getTls().isTrustAllCertificates()).isFalse();

                    SocketSmtpConnector connector = context.getBean(SocketSmtpConnector.class);
                    assertThat(connector.getHelo()).isEqualTo("mailer.example.com");
                    assertThat(connector.isTraceLog()).isTrue();
                    assertThat(connector.getSocketConfig().getBindAddress()).isEqualTo("10.0.0.5");
                    assertThat(connector.getSocketConfig().getConnectionTimeout()).isEqualTo(5000);
                    assertThat(connector.getSocketConfig().getReadTimeout()).isEqualTo(30000);

                    MailMessage message = context.getBean(MailMessageFactory.class)
                            .create("a@x.com", List.of("b@x.com"));
                    assertThat(message.getServer()).isEqualTo("smtp.example.com");
                    assertThat(message.getPort()).isEqualTo(587);
                    assertThat(message.isUseTls()).isTrue();
                });
    }

    @Test
    @DisplayName("Factory messages are independent and share the configured delivery")
    void independentMessages() {
        contextRunner
                .withPropertyValues("mailer.smtp.server=smtp.example.com")
                .run(context -> {
                    MailMessageFactory factory = context.getBean(MailMessageFactory.class);

                    MailMessage first = factory.create("a@x.com", List.of("b@x.com"));
                    MailMessage second = factory.create("c@x.com", List.of("d@x.com"));

                    assertThat(first).isNotSameAs(second);
                    assertThat(factory.getDelivery()).isSameAs(context.getBean(MailDelivery.class));
                    assertThat(factory.getDelivery().getConnector()).isSameAs(context.getBean(SmtpConnector.class));
                });
    }

    @Test
    @DisplayName("User defined connector replaces the default one")
    void customConnector() {
        SmtpConnector custom = mock(SmtpConnector.class);

        contextRunner
                .withPropertyValues("mailer.smtp.server=smtp.example.com")
                .withBean(SmtpConnector.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(SmtpConnector.class);
                    assertThat(context.getBean(MailDelivery.class).getConnector()).isSameAs(custom);
                });
    }

    @Test
    @DisplayName("Nothing is configured when mailer.enabled is false")
    void disabled() {
        contextRunner
                .withPropertyValues("mailer.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(MailMessageFactory.class);
                    assertThat(context).doesNotHaveBean(MailDelivery.class);
                });
    }
}
