package com.frenchtoast.alert.core.model;

import java.time.Instant;

/**
 * A registered webhook endpoint, identified by its owning team and channel.
 *
 * <p>{@code encryptedUrl} is the stored ciphertext. The plaintext URL is only produced at
 * delivery time, so an unreadable row fails its own delivery and nothing else.</p>
 *
 * <p>{@code lastNotified} holds the {@link Status#updated()} timestamp of the last status
 * generation successfully delivered, not the time of delivery.</p>
 */
public record Subscriber(
        long id,
        String teamId,
        String channelId,
        String encryptedUrl,
        Instant added,
        Instant lastNotified,
        boolean inactive) {

    public boolean alreadyNotified(Instant statusTimestamp) {
        return lastNotified != null && lastNotified.equals(statusTimestamp);
    }

    @Override
    public String toString() {
        return "Subscriber[id=" + id + ", team=" + teamId + ", channel=" + channelId
                + ", lastNotified=" + lastNotified + (inactive ? ", INACTIVE" : "") + "]";
    }
}
