package com.text_classifier_app.entity.converter;

import com.text_classifier_app.dto.training.TrainingConfig;
import jakarta.persistence.Converter;

@Converter
public class TrainingConfigConverter extends JsonAttributeConverter<TrainingConfig> {

    public TrainingConfigConverter() {
        super(TrainingConfig.class);
    }
}
