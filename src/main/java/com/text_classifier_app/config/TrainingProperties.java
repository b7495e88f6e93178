package com.text_classifier_app.config;

import com.text_classifier_app.dto.training.TrainingConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "training")
public class TrainingProperties {

    private Worker worker = new Worker();

    private Queue queue = new Queue();

    private Watchdog watchdog = new Watchdog();

    private Validation validation = new Validation();

    private Defaults defaults = new Defaults();

    @Data
    public static class Worker {
        /**
         * Start the queue receive loop in this process.
         */
        private boolean enabled = true;

        /**
         * Upper bound on jobs executing at the same time.
         */
        private int maxConcurrentJobs = 3;

        /**
         * Pause between polls when the queue is empty.
         */
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * How long a message refused for lack of capacity stays invisible before redelivery.
         */
        private Duration backpressureRedeliveryDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Queue {
        /**
         * Unacknowledged messages are redelivered after this deadline.
         */
        private Duration ackDeadline = Duration.ofSeconds(600);
    }

    @Data
    public static class Watchdog {
        private Duration staleAfter = Duration.ofMinutes(30);

        /**
         * Delay between two checks, read by the scheduler.
         */
        private long checkIntervalMs = 300_000;
    }

    @Data
    public static class Validation {
        private int minTotalExamples = 10;
        private int minExamplesPerLabel = 3;
        private int maxExamplesPerLabel = 50;
    }

    @Data
    public static class Defaults {
        private double validationSplit = 0.2;
        private int maxFeatures = 1000;
        private int minTermFrequency = 1;
        private int ngramMin = 1;
        private int ngramMax = 3;
        private double ridge = 0.1;
        private int maxIterations = 1000;
        private int crossValidationFolds = 5;
        private boolean gridSearch = false;
        private List<Double> ridgeGrid = new ArrayList<>(List.of(0.01, 0.1, 1.0));
        private long randomSeed = 42L;
        private int topFeatures = 10;

        public TrainingConfig toConfig() {
            return TrainingConfig.builder()
                    .validationSplit(validationSplit)
                    .maxFeatures(maxFeatures)
                    .minTermFrequency(minTermFrequency)
                    .ngramMin(ngramMin)
                    .ngramMax(ngramMax)
                    .ridge(ridge)
                    .maxIterations(maxIterations)
                    .crossValidationFolds(crossValidationFolds)
                    .gridSearch(gridSearch)
                    .ridgeGrid(List.copyOf(ridgeGrid))
                    .randomSeed(randomSeed)
                    .topFeatures(topFeatures)
                    .build();
        }
    }
}
