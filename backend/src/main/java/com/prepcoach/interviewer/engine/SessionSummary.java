package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Snapshot of the session row handed to {@link InterviewPersistence}.
 */
@Value
@Builder
public class SessionSummary {
    long id;
    String candidateName;
    String company;
    String role;
    LocalDateTime startTime;
    LocalDateTime endTime;
    Double overallScore;
    String finalVerdict;
    int resumeLength;
    int totalQuestions;
    String earlyTermination;
}
