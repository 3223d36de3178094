package com.frenchtoast.alert.jetstream.consumer;

import com.frenchtoast.alert.core.trigger.TriggerListener;
import com.frenchtoast.alert.jetstream.bootstrap.TriggerStreamReadyEvent;
import com.frenchtoast.alert.jetstream.config.TriggerQueueProperties;
import com.frenchtoast.alert.jetstream.naming.ConsumerName;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Queue trigger: every message on the check subject runs one status check.
 *
 * <p>The payload is ignored. A message is acked only after its check cycle completes; a failed
 * cycle leaves it unacked, so JetStream redelivers it after {@code ack-wait}. Messages are handled
 * one at a time per worker; several workers sharing the durable split the queue between them.</p>
 */
@Component
@ConditionalOnProperty(prefix = "frenchtoast.queue", name = "enabled", havingValue = "true", matchIfMissing = false)
public class TriggerQueueConsumer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(TriggerQueueConsumer.class);

    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    private final JetStream js;
    private final TriggerListener trigger;
    private final TriggerQueueProperties props;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public TriggerQueueConsumer(JetStream js, TriggerListener trigger, TriggerQueueProperties props) {
        this.js = js;
        this.trigger = trigger;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(TriggerStreamReadyEvent.class)
    public void onStreamReady() {
        startIfNotStarted();
    }

    private void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }

        final String durable = ConsumerName.durable(props.getDurable());

        final ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
                .durable(durable)
                .deliverPolicy(DeliverPolicy.All)
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(props.getAckWait())
                .filterSubject(props.getSubject())
                .build();

        final PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(props.getStream())
                .configuration(consumerConfig)
                .build();

        // Outer loop: subscribe, consume until failure, then subscribe again.
        Disposable d = Flux.interval(Duration.ZERO, SUBSCRIBE_RETRY_INTERVAL)
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso, durable)
                        .onErrorResume(err -> {
                            log.warn("Check queue loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    props.getStream(), durable, err.toString());
                            return Mono.empty();
                        }), 1)
                .subscribe(
                        v -> { },
                        err -> log.error("Check queue supervisor terminated unexpectedly: {}", err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso, String durable) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(props.getSubject(), pso);
                        log.info("Subscribed: stream={} subject={} durable={}", props.getStream(), props.getSubject(), durable);
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", props.getStream());
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (Exception e) {
                                log.debug("Unsubscribe failed (ignored): {}", e.toString());
                            }
                        }));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(props.getPollInterval())
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(t -> {
                    try {
                        sub.pull(props.getBatchSize());
                    } catch (Exception e) {
                        return Flux.<Void>error(new IllegalStateException("pull() failed: " + e.getMessage(), e));
                    }
                    return Flux.<Message>generate(sink -> {
                        try {
                            Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                            if (m == null) {
                                sink.complete();
                            } else {
                                sink.next(m);
                            }
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            sink.complete();
                        } catch (Exception e) {
                            sink.error(e);
                        }
                    }).concatMap(this::handle, 1);
                }, 1)
                .then();
    }

    Mono<Void> handle(Message msg) {
        return trigger.onTrigger()
                .doOnSuccess(result -> {
                    msg.ack();
                    log.debug("Check request acked: subject={} changed={}",
                            msg.getSubject(), result != null && result.changed());
                })
                .onErrorResume(err -> {
                    log.warn("Status check from queue failed; message not acked. err={}", err.toString(), err);
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
