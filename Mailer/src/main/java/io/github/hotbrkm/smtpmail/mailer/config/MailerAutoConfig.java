package io.github.hotbrkm.smtpmail.mailer.config;

import io.github.hotbrkm.smtpmail.mailer.send.MailDelivery;
import io.github.hotbrkm.smtpmail.mailer.send.MailMessageFactory;
import io.github.hotbrkm.smtpmail.mailer.send.transport.network.SocketConfig;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SmtpConnector;
import io.github.hotbrkm.smtpmail.mailer.send.transport.smtp.SocketSmtpConnector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(MailerConfig.class)
@ConditionalOnProperty(prefix = "mailer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MailerAutoConfig {

    @Bean
    @ConditionalOnMissingBean
    public SmtpConnector smtpConnector(MailerConfig mailerConfig) {
        MailerConfig.Smtp smtp = mailerConfig.getSmtp();
        SocketConfig socketConfig = new SocketConfig(smtp.getBindAddress(), smtp.getConnectionTimeout(), smtp.getReadTimeout());
        return new SocketSmtpConnector(socketConfig, smtp.getHelo(), smtp.isTrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public MailDelivery mailDelivery(SmtpConnector smtpConnector, MailerConfig mailerConfig) {
        MailerConfig.Tls tls = mailerConfig.getTls();
        return new MailDelivery(smtpConnector, tls.resolveEnabledProtocols(), tls.isTrustAllCertificates());
    }

    @Bean
    @ConditionalOnMissingBean
    public MailMessageFactory mailMessageFactory(MailDelivery mailDelivery, MailerConfig mailerConfig) {
        MailerConfig.Smtp smtp = mailerConfig.getSmtp();
        log.info("Mailer configured for SMTP server {} (port={}, useTls={})", smtp.getServer(), smtp.getPort(), smtp.isUseTls());
        return new MailMessageFactory(smtp.getServer(), smtp.getPort(), smtp.isUseTls(), mailDelivery);
    }
}
