package com.text_classifier_app.trainer;

public record LabeledText(String text, String label) {
}
