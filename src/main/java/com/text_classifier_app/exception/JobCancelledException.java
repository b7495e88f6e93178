package com.text_classifier_app.exception;


public class JobCancelledException extends RuntimeException {

    public JobCancelledException() {
        super("Training job was cancelled by user request.");
    }

    public JobCancelledException(String message) {
        super(message);
    }
}
