package com.text_classifier_app.exception;

public class TrainingInProgressException extends RuntimeException {

    public TrainingInProgressException(String projectId) {
        super("Project " + projectId + " has a training job queued or running. Cancel it and wait for it to finish first.");
    }
}
