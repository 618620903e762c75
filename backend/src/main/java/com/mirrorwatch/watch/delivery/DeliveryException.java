package com.mirrorwatch.watch.delivery;

public class DeliveryException extends RuntimeException {
    public DeliveryException(String message) {
        super(message);
    }
}
