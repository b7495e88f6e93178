package com.text_classifier_app.trainer;

import lombok.Getter;
import weka.classifiers.Classifier;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Model artifact: the fitted vectorizer and classifier (a single Weka {@code FilteredClassifier}),
 * the raw input header, the text preprocessor and the labels it can predict.
 * <p>
 * Weka filters keep per-call state, so scoring is serialized per model instance.
 */
@Getter
public class TrainedTextModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Classifier classifier;
    private final Instances header;
    private final TextPreprocessor preprocessor;
    private final List<String> labels;
    private final Instant trainedAt;
    private final String modelType;

    public TrainedTextModel(Classifier classifier, Instances header, TextPreprocessor preprocessor,
                            List<String> labels, Instant trainedAt, String modelType) {
        this.classifier = classifier;
        this.header = header;
        this.preprocessor = preprocessor;
        this.labels = List.copyOf(labels);
        this.trainedAt = trainedAt;
        this.modelType = modelType;
    }

    /**
     * @return class probabilities indexed like {@link #getLabels()}
     */
    public synchronized double[] distributionFor(String text) throws Exception {
        Instances batch = header.stringFreeStructure();
        Instance instance = new DenseInstance(batch.numAttributes());
        instance.setDataset(batch);
        instance.setValue(batch.attribute(WekaTextClassifierTrainer.TEXT_ATTRIBUTE), preprocessor.prepare(text));
        instance.setClassMissing();
        return classifier.distributionForInstance(instance);
    }
}
