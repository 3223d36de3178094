package com.frenchtoast.alert.jetstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

@Configuration
@EnableConfigurationProperties({
        NatsProperties.class,
        TriggerQueueProperties.class
})
@ConditionalOnProperty(prefix = "frenchtoast.queue", name = "enabled", havingValue = "true", matchIfMissing = false)
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties props) throws Exception {
        Options.Builder builder = new Options.Builder()
                .server(props.getUrl())
                .connectionName(props.getConnectionName());

        if (props.isTls()) {
            builder.secure();
        }

        if (hasText(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }

        if (hasText(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser(), pass);
        }

        if (hasText(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }

        Connection c = Nats.connect(builder.build());

        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getUrl(),
                props.isTls(),
                props.getUser() == null ? "" : mask(props.getUser()),
                props.getCreds() == null ? "" : props.getCreds());

        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String mask(String s) {
        if (s.length() <= 2) return "**";
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
