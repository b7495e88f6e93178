package com.text_classifier_app.trainer;

import com.text_classifier_app.dto.training.TrainingConfig;

import java.util.List;

/**
 * Turns a labeled dataset into a trained model plus metrics. Implementations do no I/O.
 */
public interface ModelTrainer {

    /**
     * @throws com.text_classifier_app.exception.DatasetValidationException when the dataset is not trainable
     * @throws com.text_classifier_app.exception.ModelTrainingException when the algorithm itself fails
     */
    TrainingOutcome train(List<LabeledText> examples, TrainingConfig config, TrainingCheckpoint checkpoint);
}
