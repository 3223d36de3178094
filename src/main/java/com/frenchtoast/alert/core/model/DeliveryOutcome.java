package com.frenchtoast.alert.core.model;

/**
 * Result of a single-subscriber delivery attempt.
 *
 * STATE EFFECTS
 * -------------
 *   DELIVERED    last_notified := status timestamp
 *   DEACTIVATED  inactive := true (endpoint answered 404)
 *   FAILED       nothing written; retried on the next cycle
 *   SKIPPED      nothing sent; already delivered or inactive
 */
public enum DeliveryOutcome {
    DELIVERED,
    DEACTIVATED,
    FAILED,
    SKIPPED
}
