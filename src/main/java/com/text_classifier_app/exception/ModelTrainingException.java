package com.text_classifier_app.exception;

public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
