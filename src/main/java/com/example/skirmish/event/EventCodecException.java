package com.example.skirmish.event;

/**
 * Thrown when a combat event cannot be encoded or decoded.
 */
public class EventCodecException extends RuntimeException {

    public EventCodecException(String message) {
        super(message);
    }

    public EventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
