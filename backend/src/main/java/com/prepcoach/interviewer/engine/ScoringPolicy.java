package com.prepcoach.interviewer.engine;

import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Decides what follows a scored answer. Pure: the caller owns every counter.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>a failed answer with the pushback budget spent forces an advance and fails the topic;</li>
 *   <li>a full score window averaging below the bar terminates the interview;</li>
 *   <li>a failed answer with budget left is pushed back on the same topic;</li>
 *   <li>the question quota or a complete stage ends the interview normally;</li>
 *   <li>anything else advances.</li>
 * </ol>
 * A forced advance still contributes its score to the window, so the next evaluation
 * can terminate.
 */
@RequiredArgsConstructor
public class ScoringPolicy {

    private final PolicySettings settings;

    public PolicyDecision decide(double score,
                                 int pushbackCount,
                                 List<Double> recentScores,
                                 int questionCount,
                                 InterviewStage stage) {
        boolean failedAnswer = score <= settings.getPushbackScoreThreshold();

        if (failedAnswer && pushbackCount >= settings.getMaxPushbacks()) {
            return PolicyDecision.forcedAdvance();
        }

        OptionalDouble windowAverage = ScoreWindow.of(recentScores, settings.getWindowSize()).average();
        if (windowAverage.isPresent() && windowAverage.getAsDouble() < settings.getEarlyTerminationAverage()) {
            return PolicyDecision.earlyTerminate(
                    String.format(Locale.ROOT, "Performance below bar (avg %.1f/10)", windowAverage.getAsDouble()));
        }

        if (failedAnswer) {
            return PolicyDecision.of(Decision.PUSHBACK);
        }

        if (questionCount >= settings.getMaxQuestions() || stage == InterviewStage.COMPLETE) {
            return PolicyDecision.of(Decision.REPORT);
        }

        return PolicyDecision.of(Decision.ADVANCE);
    }
}
