package com.text_classifier_app.exception;

public class NotTrainedException extends RuntimeException {

    public NotTrainedException(String projectId) {
        super("Project " + projectId + " is not trained yet. Train the model first.");
    }
}
