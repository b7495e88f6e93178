package com.text_classifier_app.dto.training;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResult {
    private String label;
    private double confidence;
    // runner-up labels, highest confidence first, at most two
    private List<LabelConfidence> alternatives;
}
