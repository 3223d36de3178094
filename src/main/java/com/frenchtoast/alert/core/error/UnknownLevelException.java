package com.frenchtoast.alert.core.error;

public class UnknownLevelException extends AlertEngineException {

    private final String code;

    public UnknownLevelException(String code) {
        super("Unknown status code: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
