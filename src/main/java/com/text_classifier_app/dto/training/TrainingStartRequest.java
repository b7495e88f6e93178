package com.text_classifier_app.dto.training;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optional hyperparameter overrides. Fields left null fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingStartRequest {

    @DecimalMin(value = "0.05", message = "validationSplit must be at least 0.05")
    @DecimalMax(value = "0.5", message = "validationSplit must be at most 0.5")
    private Double validationSplit;

    @Min(value = 10, message = "maxFeatures must be at least 10")
    @Max(value = 100000, message = "maxFeatures must be at most 100000")
    private Integer maxFeatures;

    @Min(value = 1, message = "minTermFrequency must be at least 1")
    @Max(value = 100, message = "minTermFrequency must be at most 100")
    private Integer minTermFrequency;

    @Min(value = 1, message = "ngramMin must be at least 1")
    @Max(value = 3, message = "ngramMin must be at most 3")
    private Integer ngramMin;

    @Min(value = 1, message = "ngramMax must be at least 1")
    @Max(value = 3, message = "ngramMax must be at most 3")
    private Integer ngramMax;

    @Positive(message = "ridge must be positive")
    private Double ridge;

    @Min(value = 10, message = "maxIterations must be at least 10")
    @Max(value = 10000, message = "maxIterations must be at most 10000")
    private Integer maxIterations;

    @Min(value = 2, message = "crossValidationFolds must be at least 2")
    @Max(value = 10, message = "crossValidationFolds must be at most 10")
    private Integer crossValidationFolds;

    private Boolean gridSearch;

    @Size(min = 1, max = 10, message = "ridgeGrid must hold between 1 and 10 values")
    private List<@Positive(message = "ridgeGrid values must be positive") Double> ridgeGrid;

    private Long randomSeed;

    @Min(value = 10, message = "topFeatures must be at least 10")
    @Max(value = 20, message = "topFeatures must be at most 20")
    private Integer topFeatures;

    @JsonIgnore
    @AssertTrue(message = "ngramMin must not exceed ngramMax")
    public boolean isNgramRangeValid() {
        return ngramMin == null || ngramMax == null || ngramMin <= ngramMax;
    }
}
