package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnswerOutcomeDto {
    private Long sessionId;
    private String decisionState;
    private String nextQuestion;
    private Integer questionNumber;
    private String stage;
    private String persona;
    private AnswerFeedbackDto feedback;
    private String terminationReason;
    private List<String> warnings;
}
