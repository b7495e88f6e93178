package com.text_classifier_app.trainer;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.exception.DatasetValidationException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks the trainability bounds before any training work starts. The bounds keep the
 * train/validation split meaningful and the training cost bounded.
 */
public class DatasetValidator {

    private final int minTotalExamples;
    private final int minExamplesPerLabel;
    private final int maxExamplesPerLabel;

    public DatasetValidator(int minTotalExamples, int minExamplesPerLabel, int maxExamplesPerLabel) {
        if (minExamplesPerLabel > maxExamplesPerLabel) {
            throw new IllegalArgumentException("minExamplesPerLabel must not exceed maxExamplesPerLabel");
        }
        this.minTotalExamples = minTotalExamples;
        this.minExamplesPerLabel = minExamplesPerLabel;
        this.maxExamplesPerLabel = maxExamplesPerLabel;
    }

    public static DatasetValidator from(TrainingProperties.Validation validation) {
        return new DatasetValidator(validation.getMinTotalExamples(),
                validation.getMinExamplesPerLabel(),
                validation.getMaxExamplesPerLabel());
    }

    /**
     * @return example count per label, sorted by label
     * @throws DatasetValidationException naming the first bound that is violated
     */
    public Map<String, Integer> validate(List<LabeledText> examples) {
        if (examples.size() < minTotalExamples) {
            throw new DatasetValidationException(
                    "Need at least " + minTotalExamples + " examples total (has " + examples.size() + ")");
        }

        Map<String, Integer> labelCounts = countLabels(examples);
        if (labelCounts.size() < 2) {
            throw new DatasetValidationException(
                    "Need at least 2 different labels to train a classifier (has " + labelCounts.size() + ")");
        }

        labelCounts.forEach((label, count) -> {
            if (count < minExamplesPerLabel) {
                throw new DatasetValidationException(
                        "Label '" + label + "' needs at least " + minExamplesPerLabel + " examples (has " + count + ")");
            }
        });

        labelCounts.forEach((label, count) -> {
            if (count > maxExamplesPerLabel) {
                throw new DatasetValidationException(
                        "Label '" + label + "' has too many examples (" + count + "), maximum is " + maxExamplesPerLabel);
            }
        });

        return labelCounts;
    }

    static Map<String, Integer> countLabels(List<LabeledText> examples) {
        Map<String, Integer> counts = new TreeMap<>();
        for (LabeledText example : examples) {
            counts.merge(example.label(), 1, Integer::sum);
        }
        return counts;
    }
}
