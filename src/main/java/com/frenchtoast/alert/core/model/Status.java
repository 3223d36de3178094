package com.frenchtoast.alert.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * The singleton current-status row.
 *
 * <p>{@code status} is the empty sentinel until the first valid level is committed, and
 * {@code updated} is null until then. {@code updated} is also the generation key that
 * subscribers store in {@code last_notified}.</p>
 */
public record Status(int id, String status, Instant updated) {

    /** The only id the status row ever has. */
    public static final int SINGLETON_ID = 1;

    /** Stored value before the first observation. Not a valid level code. */
    public static final String SENTINEL = "";

    public Optional<AlertLevel> level() {
        return AlertLevel.fromCode(status);
    }

    public boolean isInitialized() {
        return updated != null && level().isPresent();
    }
}
