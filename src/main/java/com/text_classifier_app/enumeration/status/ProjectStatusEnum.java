package com.text_classifier_app.enumeration.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProjectStatusEnum {
    DRAFT("draft"),
    QUEUED("queued"),
    TRAINING("training"),
    TRAINED("trained"),
    FAILED("failed");

    private final String value;

    ProjectStatusEnum(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
