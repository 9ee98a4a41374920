package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds used by {@link ScoringPolicy}.
 */
@Value
@Builder
public class PolicySettings {

    /** Scores at or below this value count as a failed answer. */
    @Builder.Default
    double pushbackScoreThreshold = 2.0;

    @Builder.Default
    int maxPushbacks = 2;

    /** Number of most recent scores averaged for early termination. */
    @Builder.Default
    int windowSize = 3;

    @Builder.Default
    double earlyTerminationAverage = 3.5;

    @Builder.Default
    int maxQuestions = 8;

    public static PolicySettings defaults() {
        return PolicySettings.builder().build();
    }
}
