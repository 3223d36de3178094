package com.frenchtoast.alert.jetstream.bootstrap;

/**
 * Published once the check-request stream has been created or validated.
 *
 * The queue consumer listens for it so it does not subscribe before the stream exists. Nodes
 * that never bootstrap still start consuming on {@code ApplicationReadyEvent} and wait for the
 * stream there.
 */
public record TriggerStreamReadyEvent(String stream) {
}
