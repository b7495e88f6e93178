package com.text_classifier_app.exception;

/**
 * The dataset does not meet the trainability bounds. The message is shown to the user verbatim.
 */
public class DatasetValidationException extends RuntimeException {

    public DatasetValidationException(String message) {
        super(message);
    }
}
