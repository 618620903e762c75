package com.mirrorwatch.watch.fetch;

public class FetchException extends RuntimeException {
    private final String reasonCode;
    private final String endpoint;

    public FetchException(String reasonCode, String endpoint, String message) {
        super(message);
        this.reasonCode = reasonCode;
        this.endpoint = endpoint;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
