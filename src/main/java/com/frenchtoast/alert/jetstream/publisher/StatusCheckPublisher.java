package com.frenchtoast.alert.jetstream.publisher;

import com.frenchtoast.alert.jetstream.config.TriggerQueueProperties;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * Enqueues a status-check request on the check subject.
 *
 * <p>No message id is set: two requests are two checks, and the detector already makes a
 * redundant check harmless.</p>
 */
@Component
@ConditionalOnProperty(prefix = "frenchtoast.queue", name = "enabled", havingValue = "true", matchIfMissing = false)
public class StatusCheckPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusCheckPublisher.class);

    static final byte[] PAYLOAD = "Status check".getBytes(StandardCharsets.UTF_8);

    private final JetStream js;
    private final TriggerQueueProperties props;

    public StatusCheckPublisher(JetStream js, TriggerQueueProperties props) {
        this.js = js;
        this.props = props;
    }

    /**
     * @return the stream sequence number assigned to the request
     */
    public Mono<Long> requestCheck() {
        return Mono.fromCallable(() -> {
                    // Blocking: waits for the server's publish ack.
                    PublishAck ack = js.publish(props.getSubject(), PAYLOAD);
                    log.info("Requested status check subject={} stream={} seq={}",
                            props.getSubject(), ack.getStream(), ack.getSeqno());
                    return ack.getSeqno();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
