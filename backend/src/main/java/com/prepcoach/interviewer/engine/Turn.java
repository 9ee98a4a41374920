package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One answered question. Immutable once appended to the session log.
 */
@Value
@Builder
public class Turn {
    int questionNumber;
    int topicNumber;
    int pushbackAttempt;
    InterviewStage stage;
    String question;
    String answer;
    int answerLength;
    double score;
    String strengths;
    String weaknesses;
    String tip;
    String sentiment;
    boolean degraded;
    boolean skipped;
    LocalDateTime timestamp;
}
