package com.text_classifier_app.dto.training;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Metrics bag written to a job once it is ready. All accuracy and precision values are
 * percentages rounded to two decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingResult {
    private Double accuracy;
    private Double crossValidationAccuracy;
    private Double crossValidationStd;
    private List<String> labels;
    private Map<String, Double> perClassPrecision;
    private List<List<Integer>> confusionMatrix;
    private Map<String, List<FeatureWeight>> featureImportance;
    private int trainingExamples;
    private int validationExamples;
    private int totalFeatures;
    private boolean stratified;
    private Double selectedRidge;
    private Map<String, Double> gridSearchScores;
}
