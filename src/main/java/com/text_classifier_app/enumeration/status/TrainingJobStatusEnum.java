package com.text_classifier_app.enumeration.status;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a training job. A job only ever moves forward:
 * {@code QUEUED -> TRAINING -> READY | FAILED}. A job that was cancelled before it started
 * may also go straight from {@code QUEUED} to {@code FAILED}.
 */
public enum TrainingJobStatusEnum {
    QUEUED("queued"),
    TRAINING("training"),
    READY("ready"),
    FAILED("failed");

    private final String value;

    TrainingJobStatusEnum(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    public boolean canTransitionTo(TrainingJobStatusEnum next) {
        return allowedNext().contains(next);
    }

    private Set<TrainingJobStatusEnum> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(TRAINING, FAILED);
            case TRAINING -> EnumSet.of(READY, FAILED);
            case READY, FAILED -> EnumSet.noneOf(TrainingJobStatusEnum.class);
        };
    }
}
