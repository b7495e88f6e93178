package com.text_classifier_app.trainer;

import com.text_classifier_app.dto.training.TrainingResult;

public record TrainingOutcome(TrainingResult result, TrainedTextModel model) {
}
