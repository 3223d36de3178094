package com.frenchtoast.alert.jetstream.bootstrap;

import com.frenchtoast.alert.jetstream.config.TriggerQueueProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * =====================================================================
 * TriggerStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Makes sure the JetStream stream that carries status-check requests
 * exists before the queue consumer subscribes to it.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once during startup, as an {@link ApplicationRunner}
 * - AFTER the NATS connection is established
 * - BEFORE {@code ApplicationReadyEvent}
 *
 * STREAM SHAPE
 * ------------
 * - Retention: WorkQueue (each request is consumed by exactly one worker)
 * - Subjects:  the single configured check subject
 * - MaxAge:    stale requests are dropped by the server
 *
 * An existing stream is never modified. Drift is logged as a warning.
 *
 * Disable with {@code frenchtoast.queue.bootstrap=false} on workers that
 * lack JetStream admin permissions.
 */
@Component
@ConditionalOnProperty(prefix = "frenchtoast.queue", name = "enabled", havingValue = "true", matchIfMissing = false)
public class TriggerStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TriggerStreamBootstrapper.class);

    /** JetStream API error code returned when a stream does not exist. */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final TriggerQueueProperties props;
    private final ApplicationEventPublisher publisher;

    public TriggerStreamBootstrapper(
            JetStreamManagement jsm,
            TriggerQueueProperties props,
            ApplicationEventPublisher publisher
    ) {
        this.jsm = jsm;
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!props.isBootstrap()) {
            log.info("JetStream bootstrap disabled; expecting stream {} to exist", props.getStream());
            return;
        }

        StreamConfiguration desired = toStreamConfig(props);

        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
        } catch (JetStreamApiException e) {
            // Only create when the stream truly does not exist; permission errors propagate.
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
            jsm.addStream(desired);
            log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={})",
                    desired.getName(),
                    desired.getSubjects(),
                    desired.getMaxAge(),
                    desired.getRetentionPolicy(),
                    desired.getStorageType());
        }

        publisher.publishEvent(new TriggerStreamReadyEvent(desired.getName()));
    }

    private void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }

        if (!actual.getSubjects().contains(props.getSubject())) {
            diffs.add("subjects actual=" + actual.getSubjects()
                    + " expected to contain " + props.getSubject());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})",
                    desired.getName(), actual.getSubjects());
            return;
        }

        log.warn("JetStream stream exists but differs from expected: {} :: {}",
                desired.getName(), String.join("; ", diffs));
    }

    static StreamConfiguration toStreamConfig(TriggerQueueProperties props) {
        if (props.getStream() == null || props.getStream().isBlank()) {
            throw new IllegalArgumentException("frenchtoast.queue.stream is required");
        }
        if (props.getSubject() == null || props.getSubject().isBlank()) {
            throw new IllegalArgumentException("frenchtoast.queue.subject is required");
        }

        return StreamConfiguration.builder()
                .name(props.getStream())
                .subjects(props.getSubject())
                .retentionPolicy(RetentionPolicy.WorkQueue)
                .storageType(parseStorageType(props.getStorageType()))
                .maxAge(props.getMaxAge())
                .build();
    }

    private static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file":
                return StorageType.File;
            case "memory":
                return StorageType.Memory;
            default:
                throw new IllegalArgumentException("Unsupported storageType: " + value);
        }
    }
}
