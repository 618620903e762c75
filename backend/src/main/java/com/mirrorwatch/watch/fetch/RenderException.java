package com.mirrorwatch.watch.fetch;

public class RenderException extends RuntimeException {
    private final String reasonCode;

    public RenderException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
