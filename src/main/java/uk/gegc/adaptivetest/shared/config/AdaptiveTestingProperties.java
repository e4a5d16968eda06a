package uk.gegc.adaptivetest.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.adaptivetest.features.session.domain.model.SelectionMethod;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Type-safe configuration for the adaptive testing engine.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "cat")
public class AdaptiveTestingProperties {

    @Valid
    @NotNull
    private Estimation estimation = new Estimation();

    @Valid
    @NotNull
    private Selection selection = new Selection();

    @Valid
    @NotNull
    private SessionDefaults sessionDefaults = new SessionDefaults();

    @Valid
    @NotNull
    private Report report = new Report();

    @Data
    public static class Estimation {
        /**
         * Lower bound theta is clamped to on every iteration.
         */
        private double minTheta = -4.0;

        /**
         * Upper bound theta is clamped to on every iteration.
         */
        private double maxTheta = 4.0;

        /**
         * Newton-Raphson stops once |delta theta| falls below this value.
         */
        @Positive
        private double tolerance = 1e-4;

        @Min(1)
        private int maxIterations = 50;

        /**
         * Fixed theta move applied while the response pattern is all-correct or all-incorrect.
         */
        @Positive
        private double degenerateStep = 1.0;
    }

    @Data
    public static class Selection {
        /**
         * Items shown in a larger share of sessions than this are excluded when exposure control is on.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxExposureRate = 0.3;

        /**
         * Exposure control only applies once the pool has seen this many sessions.
         */
        @Min(0)
        private int exposureWarmupSessions = 20;

        /**
         * Strength of the topic-balancing re-ranking, 0 disables it.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double topicBalanceWeight = 0.5;
    }

    @Data
    public static class SessionDefaults {
        @Min(1)
        private int maxQuestions = 20;

        @Min(0)
        private int minQuestions = 5;

        @Positive
        private double seThreshold = 0.3;

        private double initialAbility = 0.0;

        private boolean topicBalancing = true;

        private boolean exposureControl = true;

        @NotNull
        private SelectionMethod selectionMethod = SelectionMethod.MAXIMUM_INFORMATION;

        /**
         * Optional wall-clock limit for a session.
         */
        private Duration maxTime;
    }

    @Data
    public static class Report {
        @Positive
        private double confidenceZ = 1.96;

        /**
         * Topics with accuracy at or above this value are reported as strengths.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double strengthThreshold = 0.8;

        /**
         * Topics with accuracy below this value are reported as weaknesses.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double weaknessThreshold = 0.5;

        @Min(0)
        private int recommendedTopicLimit = 3;

        private double recommendedDifficultyOffset = 0.5;

        /**
         * Performance bands; a final theta falls into the last band whose lower bound it reaches.
         * A band without a lower bound catches everything below the others.
         */
        @Valid
        @NotEmpty
        private List<PerformanceLevel> performanceLevels = new ArrayList<>(List.of(
                new PerformanceLevel("low", null),
                new PerformanceLevel("medium", -1.0),
                new PerformanceLevel("high", 1.0)
        ));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PerformanceLevel {
        @NotNull
        private String name;

        private Double minTheta;
    }
}
