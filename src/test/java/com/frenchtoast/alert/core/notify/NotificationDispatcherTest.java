package com.frenchtoast.alert.core.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frenchtoast.alert.config.AlertProperties;
import com.frenchtoast.alert.config.JacksonConfig;
import com.frenchtoast.alert.core.model.AlertLevel;
import com.frenchtoast.alert.core.model.DeliveryOutcome;
import com.frenchtoast.alert.core.model.DiagnosticEvent;
import com.frenchtoast.alert.core.model.FanoutSummary;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.r2dbc.store.SubscriberStore;
import com.frenchtoast.alert.security.UrlCipher;
import com.frenchtoast.alert.testsupport.H2Database;
import com.frenchtoast.alert.testsupport.RecordingEvents;
import com.frenchtoast.alert.testsupport.RecordingWebhookClient;
import com.frenchtoast.alert.testsupport.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationDispatcherTest {

    private static final Instant ADDED = Instant.parse("2024-01-01T08:00:00Z");
    private static final Instant TS = Instant.parse("2024-02-01T12:00:00Z");

    private static final String URL_A = "https://hooks.example.org/A";
    private static final String URL_B = "https://hooks.example.org/B";
    private static final String URL_C = "https://hooks.example.org/C";

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private final UrlCipher cipher = UrlCipher.fromBase64Key(TestKeys.TOKEN_KEY);

    private SubscriberStore store;
    private RecordingWebhookClient webhook;
    private RecordingEvents events;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new SubscriberStore(H2Database.create());
        webhook = new RecordingWebhookClient();
        events = new RecordingEvents();

        AlertProperties props = new AlertProperties();
        props.setLinkUrl("https://www.universalhub.com/french-toast");
        dispatcher = new NotificationDispatcher(store, webhook, cipher, mapper, events, props);
    }

    @Test
    void rendersAttachmentForLevel() throws Exception {
        JsonNode attachment = mapper.readTree(dispatcher.render(AlertLevel.HIGH, TS)).get("attachments").get(0);

        assertThat(attachment.get("color").asText()).isEqualTo("#FF821D");
        assertThat(attachment.get("author_name").asText()).isEqualTo("French Toast Alert System");
        assertThat(attachment.get("author_link").asText()).isEqualTo("https://www.universalhub.com/french-toast");
        assertThat(attachment.get("title").asText()).isEqualTo("4 Slices / High");
        assertThat(attachment.get("text").asText()).startsWith("Heavy snow predicted.");
        assertThat(attachment.get("thumb_url").asText()).endsWith("frenchtoastorange.jpg");
        assertThat(attachment.get("ts").isIntegralNumber()).isTrue();
        assertThat(attachment.get("ts").asLong()).isEqualTo(TS.getEpochSecond());
    }

    @Test
    void deliveredSubscribersAreMarkedWithStatusTimestamp() {
        long a = add("C1", URL_A);
        long b = add("C2", URL_B);

        FanoutSummary summary = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(summary.count(DeliveryOutcome.DELIVERED)).isEqualTo(2);
        assertThat(webhook.posts()).extracting(RecordingWebhookClient.Post::url).containsExactlyInAnyOrder(URL_A, URL_B);
        assertThat(store.findById(a).block().lastNotified()).isEqualTo(TS);
        assertThat(store.findById(b).block().lastNotified()).isEqualTo(TS);
    }

    @Test
    void repeatedFanoutForSameTimestampPostsNothing() {
        add("C1", URL_A);
        add("C2", URL_B);
        dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();
        webhook.clear();

        FanoutSummary again = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(webhook.posts()).isEmpty();
        assertThat(again.attempted()).isZero();
    }

    @Test
    void notFoundDeactivatesAndExcludesFromLaterFanouts() {
        long a = add("C1", URL_A);
        long b = add("C2", URL_B);
        webhook.respond(URL_B, 404);

        FanoutSummary first = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(first.count(DeliveryOutcome.DELIVERED)).isEqualTo(1);
        assertThat(first.count(DeliveryOutcome.DEACTIVATED)).isEqualTo(1);
        Subscriber deactivated = store.findById(b).block();
        assertThat(deactivated.inactive()).isTrue();
        assertThat(deactivated.lastNotified()).isNull();
        assertThat(events.diagnostics(DiagnosticEvent.SUBSCRIBER_MARKED_INACTIVE)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("status_code", 404).containsEntry("subscriber", b));

        webhook.clear();
        Instant next = TS.plusSeconds(600);
        dispatcher.deliverAll("SEVERE", AlertLevel.SEVERE, next, false).block();

        assertThat(webhook.posts()).extracting(RecordingWebhookClient.Post::url).containsExactly(URL_A);
        assertThat(store.findById(a).block().lastNotified()).isEqualTo(next);
    }

    @Test
    void serverErrorIsRetriedOnNextFanout() {
        long a = add("C1", URL_A);
        webhook.respond(URL_A, 500);

        FanoutSummary first = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(first.count(DeliveryOutcome.FAILED)).isEqualTo(1);
        Subscriber s = store.findById(a).block();
        assertThat(s.inactive()).isFalse();
        assertThat(s.lastNotified()).isNull();
        assertThat(events.diagnostics(DiagnosticEvent.BAD_DELIVERY_RESPONSE)).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("status_code", 500).containsEntry("text", "error 500"));

        webhook.respond(URL_A, 200);
        FanoutSummary second = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(second.count(DeliveryOutcome.DELIVERED)).isEqualTo(1);
        assertThat(store.findById(a).block().lastNotified()).isEqualTo(TS);
    }

    @Test
    void transportFailureLeavesSubscriberEligible() {
        long a = add("C1", URL_A);
        webhook.respond(URL_A, -1);

        dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        Subscriber s = store.findById(a).block();
        assertThat(s.inactive()).isFalse();
        assertThat(s.lastNotified()).isNull();
        assertThat(events.diagnostics(DiagnosticEvent.BAD_DELIVERY_RESPONSE)).hasSize(1);
    }

    @Test
    void undecryptableSubscriberDoesNotStopOthers() {
        store.insert("T1", "C1", "not-a-ciphertext", ADDED).block();
        long b = add("C2", URL_B);

        FanoutSummary summary = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(summary.count(DeliveryOutcome.FAILED)).isEqualTo(1);
        assertThat(summary.count(DeliveryOutcome.DELIVERED)).isEqualTo(1);
        assertThat(store.findById(b).block().lastNotified()).isEqualTo(TS);
        assertThat(events.diagnostics(DiagnosticEvent.DELIVERY_ERROR)).hasSize(1);
    }

    @Test
    void forcedDeliveryIgnoresDedupAndInactiveFlag() {
        long a = add("C1", URL_A);
        store.markNotified(a, TS).block();
        store.markInactive(a).block();
        Subscriber s = store.findById(a).block();

        assertThat(dispatcher.deliver(s, "HIGH", AlertLevel.HIGH, TS, false).block()).isEqualTo(DeliveryOutcome.SKIPPED);
        assertThat(webhook.posts()).isEmpty();

        assertThat(dispatcher.deliver(s, "HIGH", AlertLevel.HIGH, TS, true).block()).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(webhook.postsTo(URL_A)).hasSize(1);
    }

    @Test
    void forcedFanoutReachesEveryActiveSubscriber() {
        long a = add("C1", URL_A);
        add("C2", URL_B);
        long c = add("C3", URL_C);
        store.markNotified(a, TS).block();
        store.markInactive(c).block();

        FanoutSummary summary = dispatcher.deliverAll("HIGH", AlertLevel.HIGH, TS, true).block();

        assertThat(summary.count(DeliveryOutcome.DELIVERED)).isEqualTo(2);
        assertThat(webhook.posts()).extracting(RecordingWebhookClient.Post::url).containsExactlyInAnyOrder(URL_A, URL_B);
    }

    @Test
    void slowDeliveryOfOlderStatusDoesNotRegressLastNotified() {
        long a = add("C1", URL_A);
        Subscriber snapshot = store.findById(a).block();
        Instant newer = TS.plusSeconds(600);

        dispatcher.deliverAll("SEVERE", AlertLevel.SEVERE, newer, false).block();
        dispatcher.deliver(snapshot, "HIGH", AlertLevel.HIGH, TS, false).block();

        assertThat(store.findById(a).block().lastNotified()).isEqualTo(newer);

        webhook.clear();
        dispatcher.deliverAll("SEVERE", AlertLevel.SEVERE, newer, false).block();

        assertThat(webhook.posts()).isEmpty();
    }

    private long add(String channel, String url) {
        return store.insert("T1", channel, cipher.encrypt(url), ADDED).block();
    }
}
