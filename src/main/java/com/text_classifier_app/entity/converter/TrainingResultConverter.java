package com.text_classifier_app.entity.converter;

import com.text_classifier_app.dto.training.TrainingResult;
import jakarta.persistence.Converter;

@Converter
public class TrainingResultConverter extends JsonAttributeConverter<TrainingResult> {

    public TrainingResultConverter() {
        super(TrainingResult.class);
    }
}
