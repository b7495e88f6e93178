package com.text_classifier_app.exception;

/**
 * Queue, database or blob store temporarily unavailable. Never handled in-process: the message
 * stays unacknowledged and the queue redelivers it.
 */
public class TransientInfraException extends RuntimeException {

    public TransientInfraException(String message) {
        super(message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
