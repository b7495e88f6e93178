package com.text_classifier_app.exception;

public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String path) {
        super("Model artifact not found: " + path);
    }
}
