package com.frenchtoast.alert.http;

import com.frenchtoast.alert.config.AlertProperties;
import com.frenchtoast.alert.core.error.DeliveryException;
import com.frenchtoast.alert.core.notify.WebhookClient;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * POSTs JSON to a subscriber's incoming webhook.
 *
 * <p>Only an exact 200 counts as delivered. The response body of a failure is kept on the
 * {@link DeliveryException} for diagnostics.</p>
 */
@Component
public class WebClientWebhookClient implements WebhookClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientWebhookClient(WebClient alertWebClient, AlertProperties props) {
        this.webClient = alertWebClient;
        this.timeout = props.getDeliveryTimeout();
    }

    @Override
    public Mono<Void> post(String url, String jsonBody) {
        return Mono.defer(() -> webClient.post()
                        .uri(URI.create(url))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(jsonBody)
                        .exchangeToMono(response -> {
                            int code = response.statusCode().value();
                            if (code == 200) {
                                return response.releaseBody();
                            }
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.<Void>error(DeliveryException.forStatus(code, body)));
                        }))
                .timeout(timeout)
                .onErrorMap(err -> !(err instanceof DeliveryException), DeliveryException::new);
    }
}
