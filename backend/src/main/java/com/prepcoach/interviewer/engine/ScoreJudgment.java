package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Structured verdict on one answer, 0-10 scale.
 */
@Value
@Builder
public class ScoreJudgment {

    public static final double NEUTRAL_SCORE = 5.0;
    public static final String DEGRADED_SENTIMENT = "degraded";
    public static final String SKIPPED_SENTIMENT = "skipped";

    double score;

    @Builder.Default
    String strengths = "";

    @Builder.Default
    String weaknesses = "";

    @Builder.Default
    String tip = "";

    @Builder.Default
    String sentiment = "neutral";

    /** True when the scorer could not be used and the neutral default stands in. */
    boolean degraded;

    public static ScoreJudgment degraded() {
        return ScoreJudgment.builder()
                .score(NEUTRAL_SCORE)
                .strengths("N/A")
                .weaknesses("Evaluation unavailable for this answer")
                .tip("Evaluation degraded: this score is a neutral placeholder, not an assessment")
                .sentiment(DEGRADED_SENTIMENT)
                .degraded(true)
                .build();
    }

    public static ScoreJudgment skipped() {
        return ScoreJudgment.builder()
                .score(0.0)
                .strengths("N/A")
                .weaknesses("No answer was given")
                .tip("Always attempt an answer, even a partial one, and talk through your reasoning")
                .sentiment(SKIPPED_SENTIMENT)
                .build();
    }
}
