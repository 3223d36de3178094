package com.frenchtoast.alert.core.notify;

import com.frenchtoast.alert.core.error.DeliveryException;
import reactor.core.publisher.Mono;

/**
 * Transport for subscriber notifications.
 *
 * <p>The returned Mono completes only for an HTTP 200. Anything else errors with
 * {@link DeliveryException}; implementations bound every call with a timeout.</p>
 */
public interface WebhookClient {

    Mono<Void> post(String url, String jsonBody);
}
