package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Per-stage question quotas and persona thresholds used by {@link StagePlanner}.
 * Quotas count every asked question, pushback retries included.
 */
@Value
@Builder
public class StageSettings {

    @Builder.Default
    int introQuestions = 1;

    @Builder.Default
    int technicalQuestions = 4;

    @Builder.Default
    int behavioralQuestions = 2;

    @Builder.Default
    int closingQuestions = 1;

    /** Two consecutive scores below this switch the persona to challenging. */
    @Builder.Default
    double challengingBelow = 5.0;

    /** Two consecutive scores at or above this switch the persona to supportive. */
    @Builder.Default
    double supportiveAtLeast = 8.0;

    public static StageSettings defaults() {
        return StageSettings.builder().build();
    }

    int quotaFor(InterviewStage stage) {
        return switch (stage) {
            case INTRO -> introQuestions;
            case TECHNICAL -> technicalQuestions;
            case BEHAVIORAL -> behavioralQuestions;
            case CLOSING -> closingQuestions;
            case COMPLETE -> 0;
        };
    }
}
