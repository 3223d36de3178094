package com.frenchtoast.alert.r2dbc.service;

import com.frenchtoast.alert.core.model.DeliveryOutcome;
import com.frenchtoast.alert.core.model.DiagnosticEvent;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.core.trigger.TriggerListener;
import com.frenchtoast.alert.r2dbc.store.SubscriberStore;
import com.frenchtoast.alert.security.UrlCipher;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a validated subscriber handed over by the onboarding flow and sends it the current
 * status straight away.
 *
 * Upsert is keyed on team + channel. An existing row gets the new url and is reactivated.
 */
@Service
public class SubscriberRegistrationService {

    private final SubscriberStore store;
    private final UrlCipher cipher;
    private final TriggerListener trigger;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public SubscriberRegistrationService(SubscriberStore store, UrlCipher cipher, TriggerListener trigger,
                                         ApplicationEventPublisher events, Clock clock) {
        this.store = store;
        this.cipher = cipher;
        this.trigger = trigger;
        this.events = events;
        this.clock = clock;
    }

    public Mono<Registration> register(String teamId, String channelId, String deliveryUrl) {
        return store.findByTeamAndChannel(teamId, channelId)
                .flatMap(existing -> update(existing, deliveryUrl))
                .switchIfEmpty(Mono.defer(() -> create(teamId, channelId, deliveryUrl)))
                .flatMap(subscriber -> trigger.onSubscriberRegistered(subscriber)
                        .map(outcome -> new Registration(subscriber, outcome)));
    }

    private Mono<Subscriber> create(String teamId, String channelId, String deliveryUrl) {
        return store.insert(teamId, channelId, cipher.encrypt(deliveryUrl), clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .doOnNext(id -> report(DiagnosticEvent.SUBSCRIBER_ADDED, id, teamId, channelId))
                .flatMap(store::findById);
    }

    private Mono<Subscriber> update(Subscriber existing, String deliveryUrl) {
        return store.reactivate(existing.id(), cipher.encrypt(deliveryUrl))
                .then(Mono.fromRunnable(() ->
                        report(DiagnosticEvent.SUBSCRIBER_UPDATED, existing.id(), existing.teamId(), existing.channelId())))
                .then(store.findById(existing.id()));
    }

    private void report(String name, long id, String teamId, String channelId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscriber", id);
        payload.put("team_id", teamId);
        payload.put("channel_id", channelId);
        events.publishEvent(new DiagnosticEvent(name, payload));
    }

    public record Registration(Subscriber subscriber, DeliveryOutcome initialDelivery) {
    }
}
