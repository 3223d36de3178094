package com.frenchtoast.alert.config;

import com.frenchtoast.alert.security.UrlCipher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UrlCipher urlCipher(AlertProperties props) {
        return UrlCipher.fromBase64Key(props.getTokenKey());
    }

    /**
     * One shared client for the feed and every webhook. Timeouts are applied per request.
     */
    @Bean
    public WebClient alertWebClient(WebClient.Builder builder) {
        return builder.build();
    }
}
