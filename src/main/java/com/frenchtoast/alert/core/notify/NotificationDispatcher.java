package com.frenchtoast.alert.core.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frenchtoast.alert.config.AlertProperties;
import com.frenchtoast.alert.core.error.DeliveryException;
import com.frenchtoast.alert.core.model.AlertLevel;
import com.frenchtoast.alert.core.model.DeliveryOutcome;
import com.frenchtoast.alert.core.model.DiagnosticEvent;
import com.frenchtoast.alert.core.model.FanoutSummary;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.r2dbc.store.SubscriberStore;
import com.frenchtoast.alert.security.UrlCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers a status to one or all subscribers and keeps per-subscriber bookkeeping.
 *
 * <h2>Dedup key</h2>
 * A subscriber whose {@code last_notified} differs from the status timestamp is owed the
 * current status, however many times the check has already run. Re-running a fanout for the
 * same timestamp therefore only reaches subscribers whose earlier attempt did not get a 200.
 *
 * <h2>Response handling</h2>
 * <ul>
 *   <li>200: {@code last_notified := ts}</li>
 *   <li>404: {@code inactive := true}; excluded from later fanouts until re-registration</li>
 *   <li>anything else, or no response: nothing written, retried next cycle</li>
 * </ul>
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final SubscriberStore subscribers;
    private final WebhookClient webhook;
    private final UrlCipher cipher;
    private final ObjectMapper mapper;
    private final ApplicationEventPublisher events;
    private final String linkUrl;
    private final int concurrency;

    public NotificationDispatcher(SubscriberStore subscribers, WebhookClient webhook, UrlCipher cipher,
                                  ObjectMapper mapper, ApplicationEventPublisher events, AlertProperties props) {
        this.subscribers = subscribers;
        this.webhook = webhook;
        this.cipher = cipher;
        this.mapper = mapper;
        this.events = events;
        this.linkUrl = props.getLinkUrl();
        this.concurrency = Math.max(1, props.getDeliveryConcurrency());
    }

    public Mono<DeliveryOutcome> deliver(Subscriber subscriber, String status, AlertLevel level, Instant ts, boolean force) {
        if (!force && (subscriber.inactive() || subscriber.alreadyNotified(ts))) {
            log.debug("Skipping {} for status={} ts={}", subscriber, status, ts);
            return Mono.just(DeliveryOutcome.SKIPPED);
        }

        log.info("Alerting subscriber: {} status={} force={}", subscriber, status, force);
        return Mono.fromCallable(() -> cipher.decrypt(subscriber.encryptedUrl()))
                .flatMap(url -> webhook.post(url, render(level, ts)))
                .then(Mono.defer(() -> subscribers.markNotified(subscriber.id(), ts)))
                .thenReturn(DeliveryOutcome.DELIVERED)
                .onErrorResume(DeliveryException.class, err -> handleFailure(subscriber, err));
    }

    /**
     * Fans {@code status} out to every active subscriber still owed it (all active ones when
     * {@code force}). Subscribers are independent: a failure for one is reported and the
     * others proceed. Only the subscriber selection itself can fail the returned Mono.
     */
    public Mono<FanoutSummary> deliverAll(String status, AlertLevel level, Instant ts, boolean force) {
        return subscribers.findDeliverable(ts, force)
                .flatMap(s -> deliver(s, status, level, ts, force)
                        .onErrorResume(err -> isolate(s, err)), concurrency)
                .collectList()
                .map(FanoutSummary::of)
                .doOnNext(summary -> log.info("Fanout of status={} ts={} finished: {}", status, ts, summary.counts()));
    }

    String render(AlertLevel level, Instant ts) {
        try {
            return mapper.writeValueAsString(AlertMessage.of(level, ts, linkUrl));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render alert message for " + level, e);
        }
    }

    private Mono<DeliveryOutcome> handleFailure(Subscriber subscriber, DeliveryException err) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status_code", err.getStatusCode());
        payload.put("kind", err.getKind().name());
        payload.put("text", err.getResponseBody());
        payload.put("subscriber", subscriber.id());
        payload.put("team", subscriber.teamId());

        if (err.isPermanent()) {
            log.error("Subscriber marked inactive: {}", subscriber);
            events.publishEvent(new DiagnosticEvent(DiagnosticEvent.SUBSCRIBER_MARKED_INACTIVE, payload));
            return subscribers.markInactive(subscriber.id()).thenReturn(DeliveryOutcome.DEACTIVATED);
        }

        log.error("Bad webhook response for {}: {}", subscriber, err.getMessage());
        events.publishEvent(new DiagnosticEvent(DiagnosticEvent.BAD_DELIVERY_RESPONSE, payload));
        return Mono.just(DeliveryOutcome.FAILED);
    }

    private Mono<DeliveryOutcome> isolate(Subscriber subscriber, Throwable err) {
        log.warn("Delivery to {} failed: {}", subscriber, err.toString(), err);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscriber", subscriber.id());
        payload.put("team", subscriber.teamId());
        payload.put("error", err.toString());
        events.publishEvent(new DiagnosticEvent(DiagnosticEvent.DELIVERY_ERROR, payload));
        return Mono.just(DeliveryOutcome.FAILED);
    }
}
