package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionSummaryDto {
    private Long id;
    private String candidateName;
    private String company;
    private String role;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Double overallScore;
    private String finalVerdict;
    private Integer resumeLength;
    private Integer totalQuestions;
    private String earlyTermination;
}
