package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewReportDto {
    private Long sessionId;
    private String candidateName;
    private String company;
    private String role;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Double overallScore;
    private String verdict;
    private String roadmap;
    private String earlyTermination;
    private Integer totalQuestions;
    private Integer degradedEvaluations;
    private List<String> failedTopics;
    private ProfileAnalysisDto profile;
    private List<AnswerFeedbackDto> answers;
}
