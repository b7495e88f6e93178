package com.text_classifier_app.trainer;

/**
 * Called by a trainer between phases. Implementations may report progress and may abort the
 * training by throwing, typically a {@link com.text_classifier_app.exception.JobCancelledException}.
 */
@FunctionalInterface
public interface TrainingCheckpoint {

    TrainingCheckpoint NONE = phase -> { };

    void reached(TrainingPhase phase);
}
