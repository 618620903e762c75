package com.mirrorwatch.watch.mirror;

public class NoHealthyEndpointException extends RuntimeException {
    public NoHealthyEndpointException(String message) {
        super(message);
    }
}
