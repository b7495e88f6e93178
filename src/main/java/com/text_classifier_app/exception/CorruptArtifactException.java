package com.text_classifier_app.exception;

public class CorruptArtifactException extends RuntimeException {

    public CorruptArtifactException(String path, Throwable cause) {
        super("Model artifact could not be read: " + path, cause);
    }
}
