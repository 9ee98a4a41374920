package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnswerFeedbackDto {
    private Integer questionNumber;
    private String stage;
    private Double score;
    private String strengths;
    private String weaknesses;
    private String tip;
    private String sentiment;
    private Boolean degraded;
    private Boolean skipped;
    private Integer pushbackAttempt;
}
