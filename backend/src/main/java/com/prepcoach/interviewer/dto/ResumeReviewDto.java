package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResumeReviewDto {
    private String overallGrade;
    private Integer atsScore;
    private List<String> redFlags;
    private List<String> fatalFlaws;
    private List<String> strengths;
    private Map<String, Integer> sectionScores;
    private List<String> improvementTips;
    private CompanyFitDto companyFit;
    private String detailedFeedback;
    private Boolean degraded;
    private String report;
}
