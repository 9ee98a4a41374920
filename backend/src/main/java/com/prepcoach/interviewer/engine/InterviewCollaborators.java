package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class InterviewCollaborators {
    @NonNull ProfileAnalyzer profileAnalyzer;
    @NonNull CompanyResearcher companyResearcher;
    @NonNull InterviewStrategist strategist;
    @NonNull QuestionGenerator questionGenerator;
    @NonNull AnswerScorer answerScorer;
    @NonNull ReportWriter reportWriter;
}
