package com.text_classifier_app.trainer;

/**
 * Coarse training phases, each with the job progress reported once it is reached.
 */
public enum TrainingPhase {
    VALIDATED(20),
    SPLIT(30),
    TUNED(50),
    FITTED(75),
    EVALUATED(90);

    private final double progress;

    TrainingPhase(double progress) {
        this.progress = progress;
    }

    public double getProgress() {
        return progress;
    }
}
