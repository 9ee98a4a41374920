package com.prepcoach.interviewer.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StagePlannerTest {

    private final StagePlanner planner = new StagePlanner(StageSettings.defaults());

    @Test
    void questionNumbersMapToDefaultQuotas() {
        assertThat(planner.firstStage()).isEqualTo(InterviewStage.INTRO);
        assertThat(planner.stageForQuestion(2)).isEqualTo(InterviewStage.TECHNICAL);
        assertThat(planner.stageForQuestion(5)).isEqualTo(InterviewStage.TECHNICAL);
        assertThat(planner.stageForQuestion(6)).isEqualTo(InterviewStage.BEHAVIORAL);
        assertThat(planner.stageForQuestion(8)).isEqualTo(InterviewStage.CLOSING);
        assertThat(planner.stageForQuestion(9)).isEqualTo(InterviewStage.COMPLETE);
    }

    @Test
    void pushbackKeepsTheStage() {
        StagePlan plan = planner.plan(InterviewStage.INTRO, Persona.NEUTRAL, 1, Decision.PUSHBACK, List.of(1.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.INTRO);
    }

    @Test
    void advanceMovesToStageOwningNextQuestion() {
        StagePlan plan = planner.plan(InterviewStage.INTRO, Persona.NEUTRAL, 1, Decision.ADVANCE, List.of(6.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.TECHNICAL);
    }

    @Test
    void advanceNeverMovesBackward() {
        StagePlan plan = planner.plan(InterviewStage.BEHAVIORAL, Persona.NEUTRAL, 4, Decision.ADVANCE, List.of(6.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.BEHAVIORAL);
    }

    @Test
    void pastLastQuotaIsComplete() {
        StagePlan plan = planner.plan(InterviewStage.CLOSING, Persona.NEUTRAL, 8, Decision.ADVANCE, List.of(6.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.COMPLETE);
    }

    @Test
    void twoLowScoresMakeInterviewerChallenging() {
        assertThat(planner.personaFor(List.of(7.0, 4.9, 3.0), Persona.SUPPORTIVE)).isEqualTo(Persona.CHALLENGING);
    }

    @Test
    void twoHighScoresMakeInterviewerSupportive() {
        assertThat(planner.personaFor(List.of(2.0, 8.0, 9.5), Persona.CHALLENGING)).isEqualTo(Persona.SUPPORTIVE);
    }

    @Test
    void mixedScoresAreNeutral() {
        assertThat(planner.personaFor(List.of(4.0, 8.0), Persona.CHALLENGING)).isEqualTo(Persona.NEUTRAL);
    }

    @Test
    void singleScoreKeepsCurrentPersona() {
        assertThat(planner.personaFor(List.of(1.0), Persona.SUPPORTIVE)).isEqualTo(Persona.SUPPORTIVE);
    }

    @Test
    void customQuotasShiftStageBoundaries() {
        StagePlanner shortInterview = new StagePlanner(StageSettings.builder()
                .introQuestions(1)
                .technicalQuestions(1)
                .behavioralQuestions(1)
                .closingQuestions(1)
                .build());

        assertThat(shortInterview.stageForQuestion(3)).isEqualTo(InterviewStage.BEHAVIORAL);
        assertThat(shortInterview.stageForQuestion(5)).isEqualTo(InterviewStage.COMPLETE);
    }

    @Test
    void forcedAdvanceAtLastQuotaMovesToComplete() {
        StagePlan plan = planner.plan(InterviewStage.BEHAVIORAL, Persona.NEUTRAL, 8, Decision.ADVANCE, List.of(2.0, 2.0, 2.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.COMPLETE);
        assertThat(plan.getPersona()).isEqualTo(Persona.CHALLENGING);
    }

    @Test
    void pushbackAtLastQuotaStaysInClosing() {
        StagePlan plan = planner.plan(InterviewStage.CLOSING, Persona.NEUTRAL, 8, Decision.PUSHBACK, List.of(7.0, 2.0));

        assertThat(plan.getStage()).isEqualTo(InterviewStage.CLOSING);
    }
}
