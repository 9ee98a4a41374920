package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one submitted answer: live feedback plus what happens next.
 * {@code nextQuestion} is null once the session has moved to reporting.
 */
@Value
@Builder
public class TurnOutcome {
    long sessionId;
    DecisionState decisionState;
    Turn feedback;
    String nextQuestion;
    int nextQuestionNumber;
    InterviewStage stage;
    Persona persona;
    String terminationReason;
    List<String> warnings;
}
