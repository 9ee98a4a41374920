package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class InterviewReport {
    long sessionId;
    String candidateName;
    String companyName;
    String role;
    LocalDateTime startTime;
    LocalDateTime endTime;
    double overallScore;
    String verdict;
    String roadmap;
    String earlyTerminationReason;
    int totalQuestions;
    int degradedEvaluations;
    List<String> failedTopics;
    ProfileSnapshot profile;
    List<Turn> turns;
}
