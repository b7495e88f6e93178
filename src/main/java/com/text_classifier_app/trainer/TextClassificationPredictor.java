package com.text_classifier_app.trainer;

import com.text_classifier_app.dto.training.LabelConfidence;
import com.text_classifier_app.dto.training.PredictionResult;
import com.text_classifier_app.exception.ModelTrainingException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class TextClassificationPredictor {

    static final int MAX_ALTERNATIVES = 2;

    public PredictionResult predict(String text, TrainedTextModel model) {
        double[] distribution;
        try {
            distribution = model.distributionFor(text);
        } catch (Exception e) {
            throw new ModelTrainingException("Failed to score text with the trained model", e);
        }

        List<String> labels = model.getLabels();
        int best = 0;
        for (int i = 1; i < distribution.length; i++) {
            if (distribution[i] > distribution[best]) {
                best = i;
            }
        }

        List<LabelConfidence> alternatives = new ArrayList<>();
        for (int i = 0; i < distribution.length; i++) {
            if (i != best) {
                alternatives.add(new LabelConfidence(labels.get(i), toPercent(distribution[i])));
            }
        }
        alternatives.sort(Comparator.comparingDouble(LabelConfidence::getConfidence).reversed());

        return PredictionResult.builder()
                .label(labels.get(best))
                .confidence(toPercent(distribution[best]))
                .alternatives(List.copyOf(alternatives.subList(0, Math.min(MAX_ALTERNATIVES, alternatives.size()))))
                .build();
    }

    static double toPercent(double probability) {
        return Math.round(probability * 100.0 * 100.0) / 100.0;
    }
}
