package com.frenchtoast.alert.core.trigger;

import com.frenchtoast.alert.core.detect.ChangeDetector;
import com.frenchtoast.alert.core.model.AlertLevel;
import com.frenchtoast.alert.core.model.ChangeResult;
import com.frenchtoast.alert.core.model.DeliveryOutcome;
import com.frenchtoast.alert.core.model.Status;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.core.notify.NotificationDispatcher;
import com.frenchtoast.alert.r2dbc.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Entry point of the alert engine. Driven from outside: timer ticks and queue messages call
 * {@link #onTrigger()}, the registration flow calls {@link #onSubscriberRegistered(Subscriber)}.
 *
 * <p>Invocations may overlap. Safety comes from the detector's conditional commit and the
 * dispatcher's timestamp dedup, not from locking here.</p>
 */
@Component
public class TriggerListener {

    private static final Logger log = LoggerFactory.getLogger(TriggerListener.class);

    private final ChangeDetector detector;
    private final NotificationDispatcher dispatcher;
    private final StatusStore statusStore;

    public TriggerListener(ChangeDetector detector, NotificationDispatcher dispatcher, StatusStore statusStore) {
        this.detector = detector;
        this.dispatcher = dispatcher;
        this.statusStore = statusStore;
    }

    /**
     * One check-then-fanout cycle. Persistence failures error the returned Mono; the caller
     * logs them and the next trigger retries the whole cycle.
     *
     * <p>The fanout also runs when the status did not change: subscribers whose
     * {@code last_notified} still lags the stored status (a failed POST, or a cycle that died
     * between commit and fanout) are caught up. Everyone else is filtered out by the store.</p>
     */
    public Mono<ChangeResult> onTrigger() {
        return detector.checkForChange().flatMap(result -> {
            log.info("Status changed: {}", result.changed());
            Status status = result.status();
            if (!status.isInitialized()) {
                return Mono.just(result);
            }
            AlertLevel level = result.changed() ? result.level() : status.level().orElseThrow();
            if (result.changed()) {
                log.info("Sending alerts for status={}", status.status());
            } else {
                log.debug("Catching up subscribers still owed status={} ts={}", status.status(), status.updated());
            }
            return dispatcher.deliverAll(status.status(), level, status.updated(), false)
                    .thenReturn(result);
        });
    }

    /**
     * Forced delivery of the current status to exactly one newly registered or reactivated
     * subscriber, regardless of whether the status changed.
     */
    public Mono<DeliveryOutcome> onSubscriberRegistered(Subscriber subscriber) {
        return statusStore.initialize().flatMap(status -> {
            if (!status.isInitialized()) {
                log.info("No status observed yet; nothing to send to {}", subscriber);
                return Mono.just(DeliveryOutcome.SKIPPED);
            }
            return dispatcher.deliver(subscriber, status.status(), status.level().orElseThrow(), status.updated(), true);
        });
    }
}
