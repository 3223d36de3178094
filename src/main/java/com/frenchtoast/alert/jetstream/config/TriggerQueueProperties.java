package com.frenchtoast.alert.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * The JetStream work queue that carries status-check requests.
 *
 * Message payloads are ignored; receipt alone triggers a check. Every worker uses the same
 * durable consumer so the queue is shared, not broadcast.
 */
@ConfigurationProperties(prefix = "frenchtoast.queue")
public class TriggerQueueProperties {

    /** Enable the NATS connection, stream bootstrap, consumer and publisher. */
    private boolean enabled = false;

    private String stream = "FRENCH_TOAST_CHECKS";

    private String subject = "frenchtoast.status.check";

    private String durable = "french-toast-alerter";

    /** Create the stream when missing. Disable on nodes without JetStream admin rights. */
    private boolean bootstrap = true;

    /** Unconsumed check requests older than this are discarded by the server. */
    private Duration maxAge = Duration.ofHours(1);

    /** "file" or "memory". */
    private String storageType = "file";

    private Duration pollInterval = Duration.ofSeconds(1);

    private int batchSize = 10;

    /** A check request not acked within this window is redelivered to any worker. */
    private Duration ackWait = Duration.ofMinutes(2);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getDurable() { return durable; }
    public void setDurable(String durable) { this.durable = durable; }

    public boolean isBootstrap() { return bootstrap; }
    public void setBootstrap(boolean bootstrap) { this.bootstrap = bootstrap; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public String getStorageType() { return storageType; }
    public void setStorageType(String storageType) { this.storageType = storageType; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getAckWait() { return ackWait; }
    public void setAckWait(Duration ackWait) { this.ackWait = ackWait; }
}
