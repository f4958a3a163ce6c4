package com.parley.channel;

/**
 * Thrown by an adapter when a payload parsed cleanly but does not match the
 * provider's expected schema.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }
}
