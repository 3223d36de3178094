package com.frenchtoast.alert.core.error;

/**
 * A webhook POST did not answer 200.
 *
 * <p>{@link Kind#NOT_FOUND} is permanent and deactivates the subscriber; every other kind is
 * transient and leaves the subscriber eligible for the next cycle.</p>
 */
public class DeliveryException extends AlertEngineException {

    public enum Kind {
        NOT_FOUND,
        OTHER_HTTP,
        TRANSPORT
    }

    private final Kind kind;
    private final int statusCode;
    private final String responseBody;

    public DeliveryException(Kind kind, int statusCode, String responseBody) {
        super("Webhook delivery failed: kind=" + kind + " status=" + statusCode);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public DeliveryException(Throwable cause) {
        super("Webhook delivery failed: " + cause, cause);
        this.kind = Kind.TRANSPORT;
        this.statusCode = -1;
        this.responseBody = null;
    }

    public static DeliveryException forStatus(int statusCode, String responseBody) {
        Kind kind = statusCode == 404 ? Kind.NOT_FOUND : Kind.OTHER_HTTP;
        return new DeliveryException(kind, statusCode, responseBody);
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isPermanent() {
        return kind == Kind.NOT_FOUND;
    }
}
