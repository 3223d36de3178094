package com.frenchtoast.alert.core.error;

/**
 * The upstream status feed could not be read or did not contain a usable status.
 *
 * <p>Never fatal: the change detector reports it and treats the cycle as "no change".</p>
 */
public class SourceException extends AlertEngineException {

    public enum Kind {
        /** transport failure, timeout or non-2xx response */
        NETWORK,
        /** body is not XML, or the status element is absent or empty */
        MALFORMED
    }

    private final Kind kind;

    public SourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
