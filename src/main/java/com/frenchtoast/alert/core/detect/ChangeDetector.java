package com.frenchtoast.alert.core.detect;

import com.frenchtoast.alert.core.error.SourceException;
import com.frenchtoast.alert.core.error.UnknownLevelException;
import com.frenchtoast.alert.core.model.AlertLevel;
import com.frenchtoast.alert.core.model.ChangeResult;
import com.frenchtoast.alert.core.model.DiagnosticEvent;
import com.frenchtoast.alert.core.model.Status;
import com.frenchtoast.alert.core.source.StatusSource;
import com.frenchtoast.alert.r2dbc.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether the upstream status really changed and commits the new value.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A failed fetch is never a change.</li>
 *   <li>A code outside {@link AlertLevel} is never committed.</li>
 *   <li>Equal codes (case-insensitive) leave the row and its {@code updated} untouched.</li>
 *   <li>The sentinel stored before the first observation is not a level, so the first valid
 *       fetch always counts as a change.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * No locks. The status row is re-read on every call and the commit is a conditional UPDATE;
 * of two racing checks that saw the same change only one gets a row count of 1, the other
 * reports "no change" and does not fan out.
 */
@Component
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final StatusStore store;
    private final StatusSource source;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public ChangeDetector(StatusStore store, StatusSource source, ApplicationEventPublisher events, Clock clock) {
        this.store = store;
        this.source = source;
        this.events = events;
        this.clock = clock;
    }

    public Mono<ChangeResult> checkForChange() {
        return store.initialize()
                .flatMap(current -> source.fetch()
                        .onErrorResume(SourceException.class, err -> {
                            reportBadFetch(err);
                            return Mono.empty();
                        })
                        .flatMap(fetched -> evaluate(current, fetched))
                        .defaultIfEmpty(ChangeResult.unchanged(current)));
    }

    private Mono<ChangeResult> evaluate(Status current, String fetched) {
        AlertLevel level;
        try {
            level = AlertLevel.require(fetched);
        } catch (UnknownLevelException e) {
            log.error("Unknown status: {}", e.getCode());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", e.getCode());
            payload.put("current", current.status());
            events.publishEvent(new DiagnosticEvent(DiagnosticEvent.UNKNOWN_STATUS, payload));
            return Mono.just(ChangeResult.unchanged(current));
        }

        log.info("Status: current={}, new={}", current.status(), level.code());

        if (level.code().equalsIgnoreCase(current.status())) {
            return Mono.just(ChangeResult.unchanged(current));
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return store.commitChange(level.code(), now).flatMap(committed -> {
            if (!committed) {
                log.info("Status {} was committed by a concurrent check; not fanning out", level.code());
                return store.current().map(ChangeResult::unchanged);
            }
            log.warn("New status: {} (was {})", level.code(), current.status().isEmpty() ? "<unset>" : current.status());
            return Mono.just(ChangeResult.changed(new Status(Status.SINGLETON_ID, level.code(), now), level));
        });
    }

    private void reportBadFetch(SourceException err) {
        log.error("Bad status fetch: kind={} err={}", err.getKind(), err.getMessage());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", err.getKind().name());
        payload.put("error", err.getMessage());
        events.publishEvent(new DiagnosticEvent(DiagnosticEvent.BAD_STATUS_FETCH, payload));
    }
}
