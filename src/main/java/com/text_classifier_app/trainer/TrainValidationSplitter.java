package com.text_classifier_app.trainer;

import com.text_classifier_app.exception.DatasetValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Splits examples into a train and a validation partition.
 * <p>
 * The split is stratified by label when every label has at least two examples and both
 * partitions are large enough to hold one example of every label. Otherwise it falls back to a
 * plain random split; {@link Split#stratified()} tells which branch was taken.
 */
@Slf4j
public class TrainValidationSplitter {

    public record Split(List<LabeledText> train, List<LabeledText> validation, boolean stratified) {
    }

    public Split split(List<LabeledText> examples, double validationFraction, long seed) {
        int total = examples.size();
        if (total < 2) {
            throw new DatasetValidationException("Need at least 2 examples to hold out a validation set (has " + total + ")");
        }
        int validationSize = validationSize(total, validationFraction);

        Map<String, List<LabeledText>> byLabel = groupByLabel(examples);
        int labelCount = byLabel.size();
        boolean everyLabelSplittable = byLabel.values().stream().allMatch(group -> group.size() >= 2);
        boolean partitionsFitAllLabels = validationSize >= labelCount && total - validationSize >= labelCount;

        if (everyLabelSplittable && partitionsFitAllLabels) {
            return stratifiedSplit(byLabel, validationFraction, seed);
        }
        log.info("Falling back to a random split: {} examples over {} labels cannot be stratified", total, labelCount);
        return randomSplit(examples, validationSize, seed);
    }

    static int validationSize(int total, double validationFraction) {
        int size = (int) Math.ceil(total * validationFraction);
        return Math.max(1, Math.min(total - 1, size));
    }

    private Split stratifiedSplit(Map<String, List<LabeledText>> byLabel, double validationFraction, long seed) {
        Random random = new Random(seed);
        List<LabeledText> train = new ArrayList<>();
        List<LabeledText> validation = new ArrayList<>();
        for (List<LabeledText> group : byLabel.values()) {
            List<LabeledText> shuffled = new ArrayList<>(group);
            Collections.shuffle(shuffled, random);
            int held = (int) Math.round(shuffled.size() * validationFraction);
            held = Math.max(1, Math.min(shuffled.size() - 1, held));
            validation.addAll(shuffled.subList(0, held));
            train.addAll(shuffled.subList(held, shuffled.size()));
        }
        Collections.shuffle(train, random);
        return new Split(train, validation, true);
    }

    private Split randomSplit(List<LabeledText> examples, int validationSize, long seed) {
        List<LabeledText> shuffled = new ArrayList<>(examples);
        Collections.shuffle(shuffled, new Random(seed));
        return new Split(
                new ArrayList<>(shuffled.subList(validationSize, shuffled.size())),
                new ArrayList<>(shuffled.subList(0, validationSize)),
                false);
    }

    private static Map<String, List<LabeledText>> groupByLabel(List<LabeledText> examples) {
        Map<String, List<LabeledText>> sorted = new TreeMap<>();
        for (LabeledText example : examples) {
            sorted.computeIfAbsent(example.label(), label -> new ArrayList<>()).add(example);
        }
        return new LinkedHashMap<>(sorted);
    }
}
