package com.frenchtoast.alert.core.error;

public class UrlCipherException extends AlertEngineException {

    public UrlCipherException(String message) {
        super(message);
    }

    public UrlCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
