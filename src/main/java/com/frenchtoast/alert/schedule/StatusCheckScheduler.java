package com.frenchtoast.alert.schedule;

import com.frenchtoast.alert.core.trigger.TriggerListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timer trigger: runs one status check per tick.
 *
 * Ticks that arrive while a cycle is still running are dropped, not queued. A failed cycle is
 * logged and the next tick retries it.
 */
@Component
@ConditionalOnProperty(prefix = "frenchtoast.timer", name = "enabled", havingValue = "true", matchIfMissing = false)
public class StatusCheckScheduler implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StatusCheckScheduler.class);

    private final TriggerListener trigger;
    private final Duration initialDelay;
    private final Duration interval;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public StatusCheckScheduler(
            TriggerListener trigger,
            @Value("${frenchtoast.timer.initial-delay:10s}") Duration initialDelay,
            @Value("${frenchtoast.timer.interval:5m}") Duration interval
    ) {
        this.trigger = trigger;
        this.initialDelay = initialDelay;
        this.interval = interval;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (running.get() != null) {
            return;
        }

        log.info("Status check timer started: initialDelay={} interval={}", initialDelay, interval);

        Disposable d = Flux.interval(initialDelay, interval)
                .onBackpressureDrop(tick -> log.warn("Status check still running; dropping tick {}", tick))
                .concatMap(tick -> trigger.onTrigger()
                        .onErrorResume(err -> {
                            log.warn("Status check failed; will retry on next tick. err={}", err.toString(), err);
                            return Mono.empty();
                        }), 1)
                .subscribe(
                        result -> { },
                        err -> log.error("Status check timer terminated unexpectedly: {}", err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
