package com.text_classifier_app.queue;

public record TrainingQueueMessage(String jobId, String action) {

    public static final String ACTION_START_TRAINING = "start_training";

    public static TrainingQueueMessage startTraining(String jobId) {
        return new TrainingQueueMessage(jobId, ACTION_START_TRAINING);
    }
}
