package com.text_classifier_app.trainer;

import com.text_classifier_app.config.TrainingProperties;
import com.text_classifier_app.dto.training.FeatureWeight;
import com.text_classifier_app.dto.training.TrainingConfig;
import com.text_classifier_app.dto.training.TrainingResult;
import com.text_classifier_app.exception.ModelTrainingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import weka.classifiers.Evaluation;
import weka.classifiers.functions.Logistic;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SelectedTag;
import weka.core.stemmers.NullStemmer;
import weka.core.stopwords.Null;
import weka.core.tokenizers.WordTokenizer;
import weka.filters.Filter;
import weka.filters.MultiFilter;
import weka.filters.unsupervised.attribute.RemoveUseless;
import weka.filters.unsupervised.attribute.StringToWordVector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Trains a bag-of-n-grams logistic regression with Weka.
 * <p>
 * The vectorizer (TF-IDF over the preprocessed n-gram terms) and the classifier are fitted
 * together inside one {@link FilteredClassifier}, so the artifact carries the exact feature
 * space used at training time. Class imbalance is compensated through instance weights.
 */
@Component
@Slf4j
public class WekaTextClassifierTrainer implements ModelTrainer {

    public static final String TEXT_ATTRIBUTE = "text";
    public static final String LABEL_ATTRIBUTE = "label";
    public static final String MODEL_TYPE = "logistic_regression";

    private final DatasetValidator validator;
    private final TrainValidationSplitter splitter;

    @Autowired
    public WekaTextClassifierTrainer(TrainingProperties properties) {
        this(DatasetValidator.from(properties.getValidation()), new TrainValidationSplitter());
    }

    public WekaTextClassifierTrainer(DatasetValidator validator, TrainValidationSplitter splitter) {
        this.validator = validator;
        this.splitter = splitter;
    }

    @Override
    public TrainingOutcome train(List<LabeledText> examples, TrainingConfig config, TrainingCheckpoint checkpoint) {
        Map<String, Integer> labelCounts = validator.validate(examples);
        checkpoint.reached(TrainingPhase.VALIDATED);

        List<String> labels = new ArrayList<>(labelCounts.keySet());
        log.info("🧠 Training text classifier on {} examples over {} labels {}", examples.size(), labels.size(), labels);

        TrainValidationSplitter.Split split = splitter.split(examples, config.getValidationSplit(), config.getRandomSeed());
        checkpoint.reached(TrainingPhase.SPLIT);

        try {
            return fit(split, labels, config, checkpoint);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelTrainingException("Text classifier training failed: " + e.getMessage(), e);
        }
    }

    private TrainingOutcome fit(TrainValidationSplitter.Split split, List<String> labels, TrainingConfig config,
                                TrainingCheckpoint checkpoint) throws Exception {
        TextPreprocessor preprocessor = new TextPreprocessor(config.getNgramMin(), config.getNgramMax());
        Instances train = toInstances(split.train(), labels, preprocessor, true);
        Instances validation = toInstances(split.validation(), labels, preprocessor, false);

        double ridge = config.getRidge();
        Map<String, Double> gridScores = new LinkedHashMap<>();
        CrossValidationScore crossValidation = null;
        if (config.isGridSearch() && config.getRidgeGrid() != null && !config.getRidgeGrid().isEmpty()) {
            double bestScore = -1;
            for (Double candidate : config.getRidgeGrid()) {
                CrossValidationScore score = crossValidate(train, config, candidate);
                if (score == null) {
                    log.info("Skipping ridge grid search: too few examples per label for cross-validation");
                    gridScores.clear();
                    break;
                }
                gridScores.put(String.valueOf(candidate), round(score.mean()));
                if (score.mean() > bestScore) {
                    bestScore = score.mean();
                    ridge = candidate;
                    crossValidation = score;
                }
            }
            log.info("Ridge grid search selected ridge={} (scores {})", ridge, gridScores);
        }
        checkpoint.reached(TrainingPhase.TUNED);

        if (crossValidation == null) {
            crossValidation = crossValidate(train, config, ridge);
        }

        FilteredClassifier classifier = buildClassifier(config, ridge);
        classifier.buildClassifier(train);
        checkpoint.reached(TrainingPhase.FITTED);

        Evaluation evaluation = new Evaluation(train);
        evaluation.evaluateModel(classifier, validation);

        Map<String, Double> perClassPrecision = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            double precision = evaluation.precision(i);
            perClassPrecision.put(labels.get(i), Double.isNaN(precision) ? 0.0 : round(precision * 100));
        }

        List<String> terms = predictorNames(classifier);
        TrainingResult result = TrainingResult.builder()
                .accuracy(round(evaluation.pctCorrect()))
                .crossValidationAccuracy(crossValidation == null ? null : round(crossValidation.mean()))
                .crossValidationStd(crossValidation == null ? null : round(crossValidation.std()))
                .labels(labels)
                .perClassPrecision(perClassPrecision)
                .confusionMatrix(toIntMatrix(evaluation.confusionMatrix()))
                .featureImportance(featureImportance(classifier, terms, labels, config.getTopFeatures()))
                .trainingExamples(split.train().size())
                .validationExamples(split.validation().size())
                .totalFeatures(terms.size())
                .stratified(split.stratified())
                .selectedRidge(ridge)
                .gridSearchScores(gridScores)
                .build();
        checkpoint.reached(TrainingPhase.EVALUATED);

        log.info("✅ Text classifier trained: accuracy={}%, cv={}%, features={}",
                result.getAccuracy(), result.getCrossValidationAccuracy(), result.getTotalFeatures());

        TrainedTextModel model = new TrainedTextModel(classifier, emptyDataset(labels, 0), preprocessor,
                labels, Instant.now(), MODEL_TYPE);
        return new TrainingOutcome(result, model);
    }

    FilteredClassifier buildClassifier(TrainingConfig config, double ridge) {
        WordTokenizer tokenizer = new WordTokenizer();
        tokenizer.setDelimiters(" ");

        StringToWordVector vectorizer = new StringToWordVector();
        vectorizer.setAttributeIndices("first");
        vectorizer.setTokenizer(tokenizer);
        vectorizer.setWordsToKeep(config.getMaxFeatures());
        vectorizer.setDoNotOperateOnPerClassBasis(true);
        vectorizer.setMinTermFreq(config.getMinTermFrequency());
        vectorizer.setLowerCaseTokens(false);
        vectorizer.setOutputWordCounts(true);
        vectorizer.setTFTransform(true);
        vectorizer.setIDFTransform(true);
        vectorizer.setNormalizeDocLength(
                new SelectedTag(StringToWordVector.FILTER_NORMALIZE_ALL, StringToWordVector.TAGS_FILTER));
        // terms are already stemmed and stop-word free
        vectorizer.setStemmer(new NullStemmer());
        vectorizer.setStopwordsHandler(new Null());

        MultiFilter filter = new MultiFilter();
        filter.setFilters(new Filter[]{vectorizer, new RemoveUseless()});

        Logistic logistic = new Logistic();
        logistic.setRidge(ridge);
        logistic.setMaxIts(config.getMaxIterations());

        FilteredClassifier classifier = new FilteredClassifier();
        classifier.setFilter(filter);
        classifier.setClassifier(logistic);
        return classifier;
    }

    /**
     * Stratified k-fold accuracy on the training partition, with k capped by the rarest label.
     *
     * @return {@code null} when fewer than two folds are possible
     */
    private CrossValidationScore crossValidate(Instances train, TrainingConfig config, double ridge) throws Exception {
        int folds = Math.min(config.getCrossValidationFolds(), smallestClassCount(train));
        if (folds < 2) {
            return null;
        }
        Random random = new Random(config.getRandomSeed());
        Instances data = new Instances(train);
        data.randomize(random);
        data.stratify(folds);

        double[] accuracies = new double[folds];
        for (int fold = 0; fold < folds; fold++) {
            Instances foldTrain = data.trainCV(folds, fold, random);
            Instances foldTest = data.testCV(folds, fold);
            FilteredClassifier classifier = buildClassifier(config, ridge);
            classifier.buildClassifier(foldTrain);

            // plain accuracy: fold instances still carry the class weights
            int correct = 0;
            for (Instance instance : foldTest) {
                if (classifier.classifyInstance(instance) == instance.classValue()) {
                    correct++;
                }
            }
            accuracies[fold] = foldTest.isEmpty() ? 0 : 100.0 * correct / foldTest.numInstances();
        }

        double mean = 0;
        for (double accuracy : accuracies) {
            mean += accuracy;
        }
        mean /= folds;
        double variance = 0;
        for (double accuracy : accuracies) {
            variance += (accuracy - mean) * (accuracy - mean);
        }
        return new CrossValidationScore(mean, Math.sqrt(variance / folds));
    }

    private static int smallestClassCount(Instances data) {
        int[] counts = data.attributeStats(data.classIndex()).nominalCounts;
        int smallest = Integer.MAX_VALUE;
        for (int count : counts) {
            if (count > 0) {
                smallest = Math.min(smallest, count);
            }
        }
        return smallest == Integer.MAX_VALUE ? 0 : smallest;
    }

    /**
     * Ranks terms per label by their centered logistic coefficient. Weka's multinomial logistic
     * uses the last label as reference, whose coefficients are implicitly zero.
     */
    private Map<String, List<FeatureWeight>> featureImportance(FilteredClassifier classifier, List<String> terms,
                                                               List<String> labels, int topFeatures) {
        Map<String, List<FeatureWeight>> importance = new LinkedHashMap<>();
        double[][] coefficients = ((Logistic) classifier.getClassifier()).coefficients();
        if (coefficients.length != terms.size() + 1) {
            log.warn("Coefficient rows ({}) do not match the vocabulary ({}), feature importance skipped",
                    coefficients.length, terms.size());
            return importance;
        }

        int classes = labels.size();
        Map<String, List<FeatureWeight>> weightsByLabel = new HashMap<>();
        for (int term = 0; term < terms.size(); term++) {
            double[] weights = new double[classes];
            double mean = 0;
            for (int c = 0; c < classes - 1; c++) {
                weights[c] = coefficients[term + 1][c];
                mean += weights[c];
            }
            mean /= classes;
            String displayTerm = terms.get(term).replace(TextPreprocessor.NGRAM_JOINER, " ");
            for (int c = 0; c < classes; c++) {
                weightsByLabel.computeIfAbsent(labels.get(c), l -> new ArrayList<>())
                        .add(new FeatureWeight(displayTerm, weights[c] - mean));
            }
        }

        for (String label : labels) {
            List<FeatureWeight> ranked = new ArrayList<>(weightsByLabel.getOrDefault(label, List.of()));
            ranked.sort(Comparator.comparingDouble((FeatureWeight w) -> Math.abs(w.getWeight())).reversed());
            List<FeatureWeight> top = new ArrayList<>();
            for (FeatureWeight weight : ranked.subList(0, Math.min(topFeatures, ranked.size()))) {
                top.add(new FeatureWeight(weight.getTerm(), Math.round(weight.getWeight() * 10000.0) / 10000.0));
            }
            importance.put(label, top);
        }
        return importance;
    }

    private static List<String> predictorNames(FilteredClassifier classifier) {
        Instances vectorized = classifier.getFilter().getOutputFormat();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < vectorized.numAttributes(); i++) {
            if (i != vectorized.classIndex()) {
                names.add(vectorized.attribute(i).name());
            }
        }
        return names;
    }

    private static Instances toInstances(List<LabeledText> examples, List<String> labels,
                                         TextPreprocessor preprocessor, boolean balanced) {
        Instances data = emptyDataset(labels, examples.size());
        Map<String, Double> weights = balanced ? balancedWeights(examples, labels) : Map.of();
        Attribute text = data.attribute(TEXT_ATTRIBUTE);
        for (LabeledText example : examples) {
            double[] values = new double[2];
            values[0] = text.addStringValue(preprocessor.prepare(example.text()));
            values[1] = labels.indexOf(example.label());
            data.add(new DenseInstance(weights.getOrDefault(example.label(), 1.0), values));
        }
        return data;
    }

    /**
     * n / (k * n_label), so every label contributes the same total weight.
     */
    static Map<String, Double> balancedWeights(List<LabeledText> examples, List<String> labels) {
        Map<String, Integer> counts = DatasetValidator.countLabels(examples);
        Map<String, Double> weights = new HashMap<>();
        counts.forEach((label, count) ->
                weights.put(label, (double) examples.size() / (labels.size() * (double) count)));
        return weights;
    }

    static Instances emptyDataset(List<String> labels, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute(TEXT_ATTRIBUTE, (List<String>) null));
        attributes.add(new Attribute(LABEL_ATTRIBUTE, new ArrayList<>(labels)));
        Instances data = new Instances("labeled-texts", attributes, capacity);
        data.setClassIndex(1);
        return data;
    }

    private static List<List<Integer>> toIntMatrix(double[][] matrix) {
        List<List<Integer>> rows = new ArrayList<>();
        for (double[] row : matrix) {
            List<Integer> cells = new ArrayList<>();
            for (double value : row) {
                cells.add((int) Math.round(value));
            }
            rows.add(cells);
        }
        return rows;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record CrossValidationScore(double mean, double std) {
    }
}
