package com.text_classifier_app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One labeled text as it was when the job was created.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TrainingExample {

    @Column(name = "text", nullable = false, length = 5000)
    private String text;

    @Column(name = "label", nullable = false)
    private String label;
}
