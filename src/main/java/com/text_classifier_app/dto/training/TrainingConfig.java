package com.text_classifier_app.dto.training;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Hyperparameter snapshot taken when a job is created. Never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingConfig {

    /** Fraction of the examples held out for validation. */
    double validationSplit;

    /** Upper bound on the vocabulary size kept by the vectorizer. */
    int maxFeatures;

    int minTermFrequency;

    int ngramMin;

    int ngramMax;

    /** Ridge penalty of the logistic regression. */
    double ridge;

    int maxIterations;

    int crossValidationFolds;

    boolean gridSearch;

    List<Double> ridgeGrid;

    long randomSeed;

    int topFeatures;
}
