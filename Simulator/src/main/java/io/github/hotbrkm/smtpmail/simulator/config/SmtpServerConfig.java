package io.github.hotbrkm.smtpmail.simulator.config;

import io.github.hotbrkm.smtpmail.simulator.smtp.handler.SimulatorMessageHandlerFactory;
import io.github.hotbrkm.smtpmail.simulator.smtp.policy.RejectionPolicy;
import io.github.hotbrkm.smtpmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.smtpmail.simulator.smtp.service.SmtpMessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.subethamail.smtp.server.SMTPServer;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Slf4j
@Configuration
@EnableConfigurationProperties(SimulatorSmtpProperties.class)
public class SmtpServerConfig {

    private static final String PROPERTY_PREFIX = "simulator.smtp";

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SMTPServer smtpServer(SimulatorSmtpProperties properties,
                                 SimulatorMessageHandlerFactory handlerFactory) {
        SMTPServer smtpServer = createServerBuilder(properties, handlerFactory).build();
        log.info("Simulator SMTP server is configured to listen on {}.", smtpServer.getDisplayableLocalSocketAddress());
        return smtpServer;
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public RejectionPolicy rejectionPolicy(SimulatorSmtpProperties properties) {
        return new RejectionPolicy(properties.getRejections());
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SimulatorMessageHandlerFactory simulatorMessageHandlerFactory(SimulatorSmtpProperties properties,
                                                                         SmtpMessageStore messageStore,
                                                                         RejectionPolicy rejectionPolicy) {
        return new SimulatorMessageHandlerFactory(properties, messageStore, rejectionPolicy);
    }

    /**
     * Builder shared by the Spring bean and embedded servers in tests, so both apply the same properties.
     */
    public static SMTPServer.Builder createServerBuilder(SimulatorSmtpProperties properties,
                                                         SimulatorMessageHandlerFactory handlerFactory) {
        SMTPServer.Builder builder = new SMTPServer.Builder()
                .messageHandlerFactory(handlerFactory)
                .port(properties.getPort());

        if (properties.getMaxConnections() != null) {
            builder.maxConnections(properties.getMaxConnections());
        }

        if (properties.getMaxMessageSize() != null) {
            builder.maxMessageSize(properties.getMaxMessageSize());
        }

        if (StringUtils.hasText(properties.getHostName())) {
            builder.hostName(properties.getHostName());
        }

        if (StringUtils.hasText(properties.getBindAddress())) {
            builder.bindAddress(resolveBindAddress(properties.getBindAddress()));
        }
        return builder;
    }

    private static InetAddress resolveBindAddress(String bindAddress) {
        try {
            return InetAddress.getByName(bindAddress);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid SMTP bind address: " + bindAddress, e);
        }
    }
}
