package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReportRequest {
    String candidateName;
    String companyName;
    List<Turn> turns;
    ProfileSnapshot profile;
    double overallScore;
    String earlyTerminationReason;
    List<String> failedTopics;
}
