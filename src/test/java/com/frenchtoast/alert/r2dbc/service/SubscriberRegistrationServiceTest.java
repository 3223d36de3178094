package com.frenchtoast.alert.r2dbc.service;

import com.frenchtoast.alert.config.AlertProperties;
import com.frenchtoast.alert.config.JacksonConfig;
import com.frenchtoast.alert.core.detect.ChangeDetector;
import com.frenchtoast.alert.core.model.DeliveryOutcome;
import com.frenchtoast.alert.core.model.DiagnosticEvent;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.core.notify.NotificationDispatcher;
import com.frenchtoast.alert.core.trigger.TriggerListener;
import com.frenchtoast.alert.r2dbc.store.StatusStore;
import com.frenchtoast.alert.r2dbc.store.SubscriberStore;
import com.frenchtoast.alert.security.UrlCipher;
import com.frenchtoast.alert.testsupport.H2Database;
import com.frenchtoast.alert.testsupport.RecordingEvents;
import com.frenchtoast.alert.testsupport.RecordingWebhookClient;
import com.frenchtoast.alert.testsupport.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriberRegistrationServiceTest {

    private static final Instant T0 = Instant.parse("2024-02-01T12:00:00Z");
    private static final Instant NOW = Instant.parse("2024-02-01T13:00:00Z");
    private static final String URL_OLD = "https://hooks.example.org/old";
    private static final String URL_NEW = "https://hooks.example.org/new";

    private final UrlCipher cipher = UrlCipher.fromBase64Key(TestKeys.TOKEN_KEY);

    private StatusStore statusStore;
    private SubscriberStore subscriberStore;
    private RecordingWebhookClient webhook;
    private RecordingEvents events;
    private SubscriberRegistrationService service;

    @BeforeEach
    void setUp() {
        DatabaseClient db = H2Database.create();
        statusStore = new StatusStore(db);
        subscriberStore = new SubscriberStore(db);
        webhook = new RecordingWebhookClient();
        events = new RecordingEvents();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        AlertProperties props = new AlertProperties();
        props.setLinkUrl("https://www.universalhub.com/french-toast");

        ChangeDetector detector = new ChangeDetector(statusStore, () -> Mono.just("LOW"), events, clock);
        NotificationDispatcher dispatcher = new NotificationDispatcher(subscriberStore, webhook, cipher,
                new JacksonConfig().objectMapper(), events, props);
        TriggerListener trigger = new TriggerListener(detector, dispatcher, statusStore);
        service = new SubscriberRegistrationService(subscriberStore, cipher, trigger, events, clock);
    }

    @Test
    void newSubscriberIsStoredEncryptedAndGetsCurrentStatus() {
        statusStore.initialize().block();
        statusStore.commitChange("HIGH", T0).block();

        SubscriberRegistrationService.Registration r = service.register("T1", "C1", URL_NEW).block();

        Subscriber stored = subscriberStore.findById(r.subscriber().id()).block();
        assertThat(stored.encryptedUrl()).isNotEqualTo(URL_NEW);
        assertThat(cipher.decrypt(stored.encryptedUrl())).isEqualTo(URL_NEW);
        assertThat(stored.added()).isEqualTo(NOW);
        assertThat(stored.lastNotified()).isEqualTo(T0);

        assertThat(r.initialDelivery()).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(webhook.postsTo(URL_NEW)).hasSize(1);
        assertThat(events.diagnostics(DiagnosticEvent.SUBSCRIBER_ADDED)).hasSize(1);
    }

    @Test
    void reRegistrationReplacesUrlAndReactivates() {
        statusStore.initialize().block();
        statusStore.commitChange("HIGH", T0).block();
        long id = subscriberStore.insert("T1", "C1", cipher.encrypt(URL_OLD), T0).block();
        subscriberStore.markInactive(id).block();

        SubscriberRegistrationService.Registration r = service.register("T1", "C1", URL_NEW).block();

        assertThat(r.subscriber().id()).isEqualTo(id);
        Subscriber stored = subscriberStore.findById(id).block();
        assertThat(stored.inactive()).isFalse();
        assertThat(cipher.decrypt(stored.encryptedUrl())).isEqualTo(URL_NEW);
        assertThat(webhook.postsTo(URL_NEW)).hasSize(1);
        assertThat(webhook.postsTo(URL_OLD)).isEmpty();
        assertThat(events.diagnostics(DiagnosticEvent.SUBSCRIBER_UPDATED)).hasSize(1);
        assertThat(subscriberStore.countActive().block()).isEqualTo(1L);
    }

    @Test
    void registrationBeforeFirstCheckStoresButSendsNothing() {
        SubscriberRegistrationService.Registration r = service.register("T1", "C1", URL_NEW).block();

        assertThat(r.initialDelivery()).isEqualTo(DeliveryOutcome.SKIPPED);
        assertThat(webhook.posts()).isEmpty();
        assertThat(subscriberStore.countActive().block()).isEqualTo(1L);
    }

    @Test
    void initialDeliveryFailureDoesNotUndoRegistration() {
        statusStore.initialize().block();
        statusStore.commitChange("LOW", T0).block();
        webhook.respond(URL_NEW, 500);

        SubscriberRegistrationService.Registration r = service.register("T1", "C1", URL_NEW).block();

        assertThat(r.initialDelivery()).isEqualTo(DeliveryOutcome.FAILED);
        Subscriber stored = subscriberStore.findById(r.subscriber().id()).block();
        assertThat(stored.inactive()).isFalse();
        assertThat(stored.lastNotified()).isNull();
    }
}
