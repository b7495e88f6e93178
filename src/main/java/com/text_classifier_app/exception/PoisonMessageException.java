package com.text_classifier_app.exception;

/**
 * A queue payload that cannot be interpreted. Acknowledged and dropped, never retried.
 */
public class PoisonMessageException extends RuntimeException {

    public PoisonMessageException(String message) {
        super(message);
    }

    public PoisonMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
