package com.frenchtoast.alert.core.model;

import java.util.Map;

/**
 * Structured failure signal published through Spring's event bus.
 *
 * <p>These events are the only user-visible failure surface of the fanout engine; nobody is
 * waiting synchronously on a trigger cycle.</p>
 *
 * @param name    stable snake_case event name, e.g. {@code unknown_status}
 * @param payload event details; values may be null
 */
public record DiagnosticEvent(String name, Map<String, Object> payload) {

    public static final String BAD_STATUS_FETCH = "bad_status_fetch";
    public static final String UNKNOWN_STATUS = "unknown_status";
    public static final String SUBSCRIBER_MARKED_INACTIVE = "subscriber_marked_inactive";
    public static final String BAD_DELIVERY_RESPONSE = "bad_delivery_response";
    public static final String DELIVERY_ERROR = "delivery_error";
    public static final String SUBSCRIBER_ADDED = "subscriber_added";
    public static final String SUBSCRIBER_UPDATED = "subscriber_updated";

    public DiagnosticEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
