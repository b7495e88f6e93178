package com.text_classifier_app.dto.response;

import lombok.*;

import java.time.Instant;
import java.util.UUID;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class Metadata {

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private String requestId = UUID.randomUUID().toString();
}
