package com.frenchtoast.alert.admin;

import com.frenchtoast.alert.core.model.AlertLevel;
import com.frenchtoast.alert.core.model.ChangeResult;
import com.frenchtoast.alert.core.model.Status;
import com.frenchtoast.alert.core.trigger.TriggerListener;
import com.frenchtoast.alert.jetstream.publisher.StatusCheckPublisher;
import com.frenchtoast.alert.r2dbc.store.StatusStore;
import com.frenchtoast.alert.r2dbc.store.SubscriberStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints. Unauthenticated, so off unless {@code frenchtoast.admin.enabled=true}.
 *
 * <ul>
 *   <li>{@code GET /admin/status}: stored status and active subscriber count</li>
 *   <li>{@code POST /admin/check}: runs one check-then-fanout cycle inline</li>
 *   <li>{@code POST /admin/status-check}: enqueues a check request (queue trigger only)</li>
 * </ul>
 */
@RestController
@RequestMapping(path = "/admin", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "frenchtoast.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
public class AlertAdminController {

    private final StatusStore statusStore;
    private final SubscriberStore subscriberStore;
    private final TriggerListener trigger;
    private final ObjectProvider<StatusCheckPublisher> checkPublisher;

    public AlertAdminController(StatusStore statusStore,
                                SubscriberStore subscriberStore,
                                TriggerListener trigger,
                                ObjectProvider<StatusCheckPublisher> checkPublisher) {
        this.statusStore = statusStore;
        this.subscriberStore = subscriberStore;
        this.trigger = trigger;
        this.checkPublisher = checkPublisher;
    }

    @GetMapping("/status")
    public Mono<Map<String, Object>> status() {
        return statusStore.initialize()
                .zipWith(subscriberStore.countActive())
                .map(t -> {
                    Map<String, Object> out = describe(t.getT1());
                    out.put("activeSubscribers", t.getT2());
                    return out;
                });
    }

    @PostMapping("/check")
    public Mono<Map<String, Object>> check() {
        return trigger.onTrigger().map(AlertAdminController::describeResult);
    }

    @PostMapping("/status-check")
    public Mono<Map<String, Object>> requestCheck() {
        StatusCheckPublisher publisher = checkPublisher.getIfAvailable();
        if (publisher == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "queue trigger is disabled"));
        }
        return publisher.requestCheck().map(seq -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("queued", true);
            out.put("seq", seq);
            return out;
        });
    }

    private static Map<String, Object> describeResult(ChangeResult result) {
        Map<String, Object> out = describe(result.status());
        out.put("changed", result.changed());
        return out;
    }

    private static Map<String, Object> describe(Status status) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.status());
        out.put("title", status.level().map(AlertLevel::title).orElse(null));
        out.put("updated", status.updated());
        return out;
    }
}
