package com.frenchtoast.alert.jetstream.naming;

import java.util.Locale;

/**
 * Builds JetStream durable consumer names.
 *
 * Durable names may not contain whitespace, '.', '*' or '>'; those are replaced with '_'.
 */
public final class ConsumerName {

    private ConsumerName() {}

    public static String durable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("durable name is required");
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s.*>]", "_");
    }
}
