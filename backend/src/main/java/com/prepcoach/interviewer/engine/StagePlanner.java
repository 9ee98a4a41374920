package com.prepcoach.interviewer.engine;

import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Maps question count and the latest decision to the next stage and persona.
 */
@RequiredArgsConstructor
public class StagePlanner {

    private static final InterviewStage[] ORDER = {
            InterviewStage.INTRO,
            InterviewStage.TECHNICAL,
            InterviewStage.BEHAVIORAL,
            InterviewStage.CLOSING
    };

    private final StageSettings settings;

    public InterviewStage firstStage() {
        return stageForQuestion(1);
    }

    /**
     * @param current       stage of the question just answered
     * @param persona       persona in effect for that question
     * @param questionCount questions asked so far
     * @param decision      decision taken for the answer
     * @param scores        every score recorded so far, oldest first
     */
    public StagePlan plan(InterviewStage current,
                          Persona persona,
                          int questionCount,
                          Decision decision,
                          List<Double> scores) {
        InterviewStage next = current;
        if (decision != Decision.PUSHBACK) {
            InterviewStage byCount = stageForQuestion(questionCount + 1);
            if (byCount.isAfter(current)) {
                next = byCount;
            }
        }
        return new StagePlan(next, personaFor(scores, persona));
    }

    /**
     * Stage owning the given 1-based question number, {@code COMPLETE} past the last quota.
     */
    public InterviewStage stageForQuestion(int questionNumber) {
        int upperBound = 0;
        for (InterviewStage stage : ORDER) {
            upperBound += settings.quotaFor(stage);
            if (questionNumber <= upperBound) {
                return stage;
            }
        }
        return InterviewStage.COMPLETE;
    }

    Persona personaFor(List<Double> scores, Persona current) {
        if (scores.size() < 2) {
            return current;
        }
        double previous = scores.get(scores.size() - 2);
        double latest = scores.get(scores.size() - 1);
        if (previous < settings.getChallengingBelow() && latest < settings.getChallengingBelow()) {
            return Persona.CHALLENGING;
        }
        if (previous >= settings.getSupportiveAtLeast() && latest >= settings.getSupportiveAtLeast()) {
            return Persona.SUPPORTIVE;
        }
        return Persona.NEUTRAL;
    }
}
