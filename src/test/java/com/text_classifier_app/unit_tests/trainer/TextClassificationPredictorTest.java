package com.text_classifier_app.unit_tests.trainer;

import com.text_classifier_app.dto.training.PredictionResult;
import com.text_classifier_app.exception.ModelTrainingException;
import com.text_classifier_app.trainer.TextClassificationPredictor;
import com.text_classifier_app.trainer.TrainedTextModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextClassificationPredictorTest {

    @Mock
    private TrainedTextModel model;

    private final TextClassificationPredictor predictor = new TextClassificationPredictor();

    @Test
    @DisplayName("Should return the top label and at most two alternatives by confidence")
    void predict_FourLabels_ReturnsTopAndTwoAlternatives() throws Exception {
        // Given
        when(model.getLabels()).thenReturn(List.of("a", "b", "c", "d"));
        when(model.distributionFor("text")).thenReturn(new double[]{0.1, 0.2, 0.3, 0.4});

        // When
        PredictionResult result = predictor.predict("text", model);

        // Then
        assertEquals("d", result.getLabel());
        assertEquals(40.0, result.getConfidence());
        assertEquals(2, result.getAlternatives().size());
        assertEquals("c", result.getAlternatives().get(0).getLabel());
        assertEquals(30.0, result.getAlternatives().get(0).getConfidence());
        assertEquals("b", result.getAlternatives().get(1).getLabel());
    }

    @Test
    @DisplayName("Confidences are percentages rounded to two decimals")
    void predict_Probabilities_RoundedToTwoDecimals() throws Exception {
        when(model.getLabels()).thenReturn(List.of("neg", "pos"));
        when(model.distributionFor("text")).thenReturn(new double[]{0.123456, 0.876544});

        PredictionResult result = predictor.predict("text", model);

        assertEquals("pos", result.getLabel());
        assertEquals(87.65, result.getConfidence());
        assertEquals(12.35, result.getAlternatives().get(0).getConfidence());
    }

    @Test
    @DisplayName("Scoring failures are wrapped")
    void predict_ModelThrows_WrapsException() throws Exception {
        when(model.distributionFor("text")).thenThrow(new IllegalStateException("broken filter"));

        assertThrows(ModelTrainingException.class, () -> predictor.predict("text", model));
    }
}
