package com.auscomply.api.error;

/**
 * Invalid state transition, such as withdrawing a consent that is no longer GRANTED
 * or processing a request that is already terminal. No state was changed.
 */
public class StateConflictException extends RuntimeException {
    public StateConflictException(String message) { super(message); }
}
