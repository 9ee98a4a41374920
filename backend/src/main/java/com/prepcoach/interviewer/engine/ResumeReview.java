package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Pre-interview critique of a resume: letter grade A-F, ATS score 0-100, section scores 0-10.
 */
@Value
@Builder
public class ResumeReview {

    public static final String FAILED_GRADE = "F";

    String overallGrade;
    int atsScore;

    @Builder.Default
    List<String> redFlags = List.of();

    @Builder.Default
    List<String> fatalFlaws = List.of();

    @Builder.Default
    List<String> strengths = List.of();

    @Builder.Default
    Map<String, Integer> sectionScores = Map.of();

    @Builder.Default
    List<String> improvementTips = List.of();

    /** Null when no company was given or the model did not assess fit. */
    CompanyFit companyFit;

    @Builder.Default
    String detailedFeedback = "";

    /** True when the analysis could not run and this placeholder stands in. */
    boolean degraded;

    public static ResumeReview failed(String reason) {
        return ResumeReview.builder()
                .overallGrade(FAILED_GRADE)
                .atsScore(0)
                .redFlags(List.of("Analysis failed - resume may be unparseable"))
                .fatalFlaws(List.of("Resume could not be analyzed properly"))
                .improvementTips(List.of("Ensure resume is plain text, not a scanned image"))
                .detailedFeedback("Analysis error: " + reason)
                .degraded(true)
                .build();
    }
}
